package com.gt.studyscheduler.review;

import com.gt.studyscheduler.model.*;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/rest/study")
public class StudySessionController {

    private final StudySessionService studySessionService;

    public StudySessionController(StudySessionService studySessionService) {
        this.studySessionService = studySessionService;
    }

    @PostMapping(value = "plan", consumes = "application/json", produces = "application/json")
    public StudySessionPlan planSession(@RequestBody PlanSessionRequest request) {
        StudySessionOptions options = request.options() == null ? StudySessionOptions.defaults() : request.options();

        return studySessionService.planSession(request.allItemIds() == null ? List.of() : request.allItemIds(), options);
    }

    @PostMapping(value = "start", produces = "application/json")
    public StudySession startSession(@RequestParam(value = "sessionId") String sessionId) {
        return studySessionService.startSession(sessionId);
    }

    @PostMapping(value = "result", consumes = "application/json", produces = "application/json")
    public StudySession recordResult(@RequestBody RecordResultRequest request) {
        return studySessionService.recordResult(request.session(), request.result());
    }

    @PostMapping(value = "complete", consumes = "application/json", produces = "application/json")
    public StudySession completeSession(@RequestBody StudySession session) {
        return studySessionService.completeSession(session);
    }

    @GetMapping(value = "stats", produces = "application/json")
    public StudyStats getStudyStats() {
        return studySessionService.getStudyStats();
    }

    @GetMapping(value = "dueCards", produces = "application/json")
    public List<CardMemoryState> getCardsDueForReview(@RequestParam(value = "limit", defaultValue = "" + DueSelector.DEFAULT_REVIEW_LIMIT) int limit) {
        return studySessionService.getCardsDueForReview(limit);
    }

    @GetMapping(value = "recentSessions", produces = "application/json")
    public List<StudySession> getRecentSessions(@RequestParam(value = "limit", defaultValue = "" + StudySessionService.DEFAULT_RECENT_SESSION_COUNT) int limit) {
        return studySessionService.getRecentSessions(limit);
    }

    @DeleteMapping("sessions")
    public boolean clearStudySessions() {
        return studySessionService.clearStudySessions();
    }

    @GetMapping(value = "qualityRatings", produces = "application/json")
    public Map<Integer, String> getQualityRatings() {
        Map<Integer, String> qualityRatings = new LinkedHashMap<>();
        Arrays.stream(QualityRating.values()).forEach(rating -> qualityRatings.put(rating.getValue(), rating.getDescription()));

        return qualityRatings;
    }

    record PlanSessionRequest(List<String> allItemIds, StudySessionOptions options) { }
    record RecordResultRequest(StudySession session, StudyResult result) { }
}
