package com.kreasipositif.wpsprocessor.domain;

/**
 * SIF is used when the employer and employees bank with WPS agents; NON_SIF covers
 * exchange-house style payments. The encoded layout is the same for both.
 */
public enum FileType {
    SIF,
    NON_SIF
}
