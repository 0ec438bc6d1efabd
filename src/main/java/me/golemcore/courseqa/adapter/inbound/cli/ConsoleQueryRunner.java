package me.golemcore.courseqa.adapter.inbound.cli;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.courseqa.domain.model.CourseAnalytics;
import me.golemcore.courseqa.domain.model.QueryAnswer;
import me.golemcore.courseqa.domain.model.Source;
import me.golemcore.courseqa.domain.service.CourseQueryService;
import me.golemcore.courseqa.domain.system.toolloop.RoundControllerException;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

/**
 * Interactive console over {@link CourseQueryService}. Enabled with
 * {@code courseqa.cli.enabled=true}.
 *
 * <p>
 * Commands: {@code /courses} lists the catalog, {@code /new} starts a new
 * session, {@code /quit} exits. Any other line is asked as a question in the
 * current session.
 */
@Component
@ConditionalOnProperty(prefix = "courseqa.cli", name = "enabled", havingValue = "true")
@Slf4j
public class ConsoleQueryRunner implements CommandLineRunner {

    static final String CMD_COURSES = "/courses";
    static final String CMD_NEW = "/new";
    static final String CMD_QUIT = "/quit";

    private final CourseQueryService queryService;
    private final BufferedReader in;
    private final PrintStream out;

    private String sessionId;

    @Autowired
    public ConsoleQueryRunner(CourseQueryService queryService) {
        this(queryService, new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                System.out);
    }

    ConsoleQueryRunner(CourseQueryService queryService, BufferedReader in, PrintStream out) {
        this.queryService = queryService;
        this.in = in;
        this.out = out;
    }

    @Override
    public void run(String... args) throws IOException {
        out.println("Ask about the course materials (" + CMD_COURSES + ", " + CMD_NEW + ", " + CMD_QUIT + ")");
        String line;
        while ((line = prompt()) != null) {
            String input = line.strip();
            if (input.isEmpty()) {
                continue;
            }
            if (CMD_QUIT.equals(input)) {
                break;
            }
            handle(input);
        }
    }

    private String prompt() throws IOException {
        out.print("> ");
        out.flush();
        return in.readLine();
    }

    private void handle(String input) {
        switch (input) {
        case CMD_COURSES -> printCourses(queryService.getCourseAnalytics());
        case CMD_NEW -> {
            queryService.endSession(sessionId);
            sessionId = null;
            out.println("Started a new session.");
        }
        default -> ask(input);
        }
    }

    private void ask(String question) {
        try {
            QueryAnswer answer = queryService.query(question, sessionId);
            sessionId = answer.sessionId();
            out.println(answer.text());
            if (!answer.sources().isEmpty()) {
                out.println();
                out.println("Sources:");
                for (Source source : answer.sources()) {
                    out.println("  - " + source.displayText() + (source.hasLink() ? " <" + source.link() + ">" : ""));
                }
            }
        } catch (RoundControllerException e) {
            log.warn("[CLI] Query failed: {}", e.getMessage());
            out.println("Error: " + e.getMessage());
        }
    }

    private void printCourses(CourseAnalytics analytics) {
        out.println("Courses: " + analytics.totalCourses());
        analytics.courseTitles().forEach(title -> out.println("  - " + title));
    }
}
