package com.williamcallahan.actdb.service;

/**
 * Progress of one act through a recalculation step. A failure leaves the act at the stage it
 * had reached; nothing is persisted for it.
 */
public enum AmendmentStage {
    UNTOUCHED,
    EXTRACTED,
    ORDERED,
    APPLIED
}
