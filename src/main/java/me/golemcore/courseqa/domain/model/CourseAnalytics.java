package me.golemcore.courseqa.domain.model;

import java.util.List;

/** Catalog statistics of the course corpus. */
public record CourseAnalytics(int totalCourses, List<String> courseTitles) {

    public CourseAnalytics {
        courseTitles = courseTitles == null ? List.of() : List.copyOf(courseTitles);
    }
}
