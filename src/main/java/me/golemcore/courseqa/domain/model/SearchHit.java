package me.golemcore.courseqa.domain.model;

/**
 * One chunk of course content matched by a search.
 *
 * @param content
 *            chunk text
 * @param courseTitle
 *            title of the course the chunk belongs to, may be {@code null}
 * @param lessonNumber
 *            lesson number, {@code null} for course-level chunks
 */
public record SearchHit(String content, String courseTitle, Integer lessonNumber) {
}
