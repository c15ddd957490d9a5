package com.datafetch.domain.pool;

/**
 * Raised when an elastic pool cannot be provisioned or does not become ready in time.
 * Fatal to the job that requested the pool; never retried automatically.
 */
public class PoolProvisioningException extends RuntimeException {

    public PoolProvisioningException(String message) {
        super(message);
    }

    public PoolProvisioningException(String message, Throwable cause) {
        super(message, cause);
    }
}
