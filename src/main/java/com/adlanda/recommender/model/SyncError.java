package com.adlanda.recommender.model;

/**
 * A catalog item the sync run could not reconcile.
 */
public record SyncError(String itemId, String reason) {
}
