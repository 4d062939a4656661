package eu.hhmmss.devactivity.controller;

import eu.hhmmss.devactivity.aggregation.DailyReport;
import eu.hhmmss.devactivity.report.ActivityReport;
import eu.hhmmss.devactivity.report.ActivityReportService;
import eu.hhmmss.devactivity.tasks.TaskCategory;
import eu.hhmmss.devactivity.tasks.TaskParseResult;
import eu.hhmmss.devactivity.tasks.TaskParser;
import eu.hhmmss.devactivity.validation.ActivityParseException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Controller;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseBody;

/**
 * JSON endpoints over the reporting service. Request bodies carry the raw text;
 * reading files or running git is left to the caller.
 */
@Slf4j
@Controller
@RequiredArgsConstructor
@RequestMapping("/api/report")
public class ReportController {

    private final ActivityReportService activityReportService;
    private final TaskParser taskParser;

    /**
     * Full report from a history dump and a task list.
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public ActivityReport buildReport(@RequestBody ReportRequest request) throws ActivityParseException {
        log.info("Report requested: history={} chars, tasks={} chars",
                length(request.getHistory()), length(request.getTasks()));
        return activityReportService.buildReport(request.getHistory(), request.getTasks());
    }

    /**
     * Daily table only, from a plain text history dump.
     */
    @PostMapping(path = "/daily", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public DailyReport buildDailyReport(@RequestBody(required = false) String history) throws ActivityParseException {
        return activityReportService.buildDailyReport(history);
    }

    /**
     * Parsed tasks and malformed lines, from a plain text task list.
     * With {@code category} set, only tasks of that category are returned.
     */
    @PostMapping(path = "/tasks", consumes = MediaType.TEXT_PLAIN_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    @ResponseBody
    public TaskParseResult parseTasks(@RequestBody(required = false) String tasks,
                                      @RequestParam(required = false) TaskCategory category) {
        return taskParser.parse(tasks == null ? "" : tasks).filterByCategory(category);
    }

    private static int length(String text) {
        return text == null ? 0 : text.length();
    }
}
