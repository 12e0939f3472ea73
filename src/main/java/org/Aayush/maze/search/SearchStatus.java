package org.Aayush.maze.search;

/**
 * Progress of a stepwise search.
 */
public enum SearchStatus {
    /** More cells can be dequeued. */
    IN_PROGRESS,
    /** The end cell has been dequeued and yielded. */
    FOUND,
    /** The frontier ran dry without reaching the end cell. */
    NOT_FOUND
}
