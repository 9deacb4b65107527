package com.ryuqq.jobstore.testkit.contract;

import java.util.List;
import java.util.Map;

/**
 * Job targets used by contract tests.
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class SampleJobs {

    public void sendEmail(String to, int retries) {
    }

    public void processOrders(List<String> orderIds, Map<String, Integer> quantities) {
    }

    public void processReport(Report report) {
    }

    public static void cleanup() {
    }

    /**
     * Structured argument.
     *
     * @param name  report name
     * @param pages page count
     */
    public record Report(String name, int pages) {
    }
}
