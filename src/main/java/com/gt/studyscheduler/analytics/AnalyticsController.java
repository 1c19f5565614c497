package com.gt.studyscheduler.analytics;

import com.gt.studyscheduler.model.CardMemoryState;
import com.gt.studyscheduler.model.RecentPerformance;
import com.gt.studyscheduler.model.StudyAnalytics;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/rest/analytics")
public class AnalyticsController {

    private final AnalyticsEngine analyticsEngine;

    public AnalyticsController(AnalyticsEngine analyticsEngine) {
        this.analyticsEngine = analyticsEngine;
    }

    @GetMapping(value = "summary", produces = "application/json")
    public StudyAnalytics getStudyAnalytics(@RequestParam(value = "days", defaultValue = "" + AnalyticsEngine.DEFAULT_ANALYTICS_DAYS) int days) {
        return analyticsEngine.getStudyAnalytics(days);
    }

    @GetMapping(value = "struggling", produces = "application/json")
    public List<CardMemoryState> getStruggleCards(@RequestParam(value = "limit", defaultValue = "" + AnalyticsEngine.DEFAULT_CARD_LIMIT) int limit) {
        return analyticsEngine.getStruggleCards(limit);
    }

    @GetMapping(value = "mastered", produces = "application/json")
    public List<CardMemoryState> getMasteredCards(@RequestParam(value = "limit", defaultValue = "" + AnalyticsEngine.DEFAULT_CARD_LIMIT) int limit) {
        return analyticsEngine.getMasteredCards(limit);
    }

    @GetMapping(value = "recentPerformance", produces = "application/json")
    public RecentPerformance getRecentPerformance(@RequestParam(value = "days", defaultValue = "" + AnalyticsEngine.DEFAULT_PERFORMANCE_DAYS) int days) {
        return analyticsEngine.getRecentPerformance(days);
    }
}
