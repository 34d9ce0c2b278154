package com.rollup.service.persistence;

/**
 * Pageviews and visitors for one path summed over a date range.
 */
public record PathTotal(String path, long pageviews, long visitors) {
}
