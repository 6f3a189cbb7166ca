package com.kreasipositif.wpsprocessor.submission;

/**
 * <pre>
 *  DRAFT ─► SUBMITTED ─► PROCESSING ─► SUCCESS
 *    ▲          │             └──────► FAILED
 *    └──────────┴── attempt failed, budget left
 *  FAILED ─► DRAFT while retries remain
 *  any non-terminal ─► CANCELLED
 * </pre>
 */
public enum SubmissionState {
    DRAFT,
    SUBMITTED,
    PROCESSING,
    SUCCESS,
    FAILED,
    CANCELLED
}
