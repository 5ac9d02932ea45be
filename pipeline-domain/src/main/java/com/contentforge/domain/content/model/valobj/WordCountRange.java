package com.contentforge.domain.content.model.valobj;

/**
 * Inclusive word count range [min, max].
 */
public record WordCountRange(int min, int max) {

    public boolean isWellFormed() {
        return min > 0 && max >= min;
    }

    public boolean contains(int wordCount) {
        return wordCount >= min && wordCount <= max;
    }

    @Override
    public String toString() {
        return min + "-" + max;
    }
}
