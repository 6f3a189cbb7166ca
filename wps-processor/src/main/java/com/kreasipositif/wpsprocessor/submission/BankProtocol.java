package com.kreasipositif.wpsprocessor.submission;

/**
 * Channel a bank accepts WPS files on.
 */
public enum BankProtocol {
    REST,
    SOAP,
    SFTP,
    /** The file is uploaded by a person on the bank's portal; the outcome is confirmed by hand. */
    MANUAL_PORTAL
}
