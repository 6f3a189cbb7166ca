package com.kreasipositif.wpsprocessor.exception;

/** Raised by line assembly when the employer scope yields no employee with an active contract. */
public class NoEligibleEmployeesException extends WpsException {

    public NoEligibleEmployeesException(String message) {
        super(message);
    }
}
