package com.kreasipositif.wpsprocessor.assembly;

/**
 * Salary account of an employee as held by the HR system.
 *
 * @param routingCode WPS agent/routing code, when the HR system already knows it
 * @param swiftCode   BIC of the bank, used to look the routing code up otherwise
 */
public record BankAccountRecord(String accountNumber, String iban, String routingCode, String swiftCode) {
}
