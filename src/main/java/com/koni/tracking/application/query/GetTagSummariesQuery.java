package com.koni.tracking.application.query;

/**
 * Query to retrieve the current summary of every tracked tag.
 */
public class GetTagSummariesQuery {
    // No parameters - returns all tags
}
