package com.polyfetch.backend.rpc;

import com.polyfetch.common.BackendException;
import com.polyfetch.common.ErrorKind;

public class AccountNotFoundException extends BackendException {

    public AccountNotFoundException(String accountId) {
        super(ErrorKind.ACCOUNT_NOT_FOUND, "Account " + accountId + " does not exist");
    }
}
