package me.golemcore.courseqa.port.outbound;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import me.golemcore.courseqa.domain.model.CourseOutline;
import me.golemcore.courseqa.domain.model.SearchResults;

import java.util.List;
import java.util.Optional;

/**
 * Port to the course content store that holds chunked, embedded course
 * material and course metadata. Chunking, embedding and similarity search live
 * behind this port.
 */
public interface CourseContentPort {

    /**
     * Semantic search over course content.
     *
     * @param query
     *            what to search for
     * @param courseName
     *            optional course filter; partial names are resolved by the store
     * @param lessonNumber
     *            optional lesson filter
     * @return matched chunks, or an error message; never {@code null}
     */
    SearchResults search(String query, String courseName, Integer lessonNumber);

    /**
     * Resolves a partial or approximate course name to the stored course title.
     */
    Optional<String> resolveCourseName(String courseName);

    /**
     * Returns the link of a lesson, if the store knows one.
     */
    Optional<String> getLessonLink(String courseTitle, int lessonNumber);

    /**
     * Returns metadata of the course with the exact given title.
     */
    Optional<CourseOutline> getCourseOutline(String courseTitle);

    /**
     * Returns the titles of all stored courses.
     */
    List<String> getAllCourseTitles();
}
