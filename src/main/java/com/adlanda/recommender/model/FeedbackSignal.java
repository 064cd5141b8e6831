package com.adlanda.recommender.model;

/**
 * Kinds of user feedback the learning loop consumes.
 *
 * Ratings feed the global helpful ratio; engagement signals adjust the user's
 * category interests.
 */
public enum FeedbackSignal {

    HELPFUL(true, 0),
    SOMEWHAT_HELPFUL(true, 0),
    NOT_HELPFUL(true, 0),
    CLICKED(false, 1),
    SAVED(false, 2),
    IGNORED(false, -1);

    private final boolean rating;
    private final int interestWeight;

    FeedbackSignal(boolean rating, int interestWeight) {
        this.rating = rating;
        this.interestWeight = interestWeight;
    }

    public boolean isRating() {
        return rating;
    }

    public boolean isEngagement() {
        return !rating;
    }

    /**
     * Change applied to the user's tally for the item's category.
     */
    public int interestWeight() {
        return interestWeight;
    }
}
