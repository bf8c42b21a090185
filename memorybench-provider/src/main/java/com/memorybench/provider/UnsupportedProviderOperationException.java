package com.memorybench.provider;

/**
 * Thrown when a caller invokes an operation the adapter does not implement, for example
 * {@code delete_memory} on a wrapped legacy provider.
 */
public class UnsupportedProviderOperationException extends UnsupportedOperationException {

    private static final long serialVersionUID = 1L;

    private final String providerName;
    private final String operation;

    /**
     * @param operation snake_case operation name, e.g. {@code update_memory}
     */
    public UnsupportedProviderOperationException(String providerName, String operation) {
        super("Provider '" + providerName + "' does not support operation: " + operation);
        this.providerName = providerName;
        this.operation = operation;
    }

    public String getProviderName() {
        return providerName;
    }

    public String getOperation() {
        return operation;
    }
}
