package com.polyfetch.backend;

import com.polyfetch.common.FetchResult;

/**
 * One external system behind a uniform fetch. Implementations never throw from {@link #fetch()}: typed failures
 * come back as {@link FetchResult#failure}.
 */
public interface BackendClient<T> {

    /**
     * Backend name used in logs and error descriptors.
     */
    String name();

    FetchResult<T> fetch();
}
