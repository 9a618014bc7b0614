package com.aknmodel.core.xml;

/**
 * Thrown when markup parses but is not structurally valid Akoma Ntoso.
 *
 * <p>Raised for a misnamed root element, a root without children, a first child that does
 * not match the expected document type, and a tree declaring none of the known
 * Akoma Ntoso namespaces. Messages name both the expected and the actual value.
 */
public class AknValidationException extends IllegalArgumentException {

    public AknValidationException(String message) {
        super(message);
    }
}
