package com.gt.studyscheduler.practiceSet;

import com.gt.studyscheduler.model.FlashcardSetSchedule;
import com.gt.studyscheduler.model.PracticeFrequency;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;

@RestController
@RequestMapping("/rest/practiceSet")
public class PracticeSetController {

    private final SetScheduler setScheduler;

    public PracticeSetController(SetScheduler setScheduler) {
        this.setScheduler = setScheduler;
    }

    @GetMapping(value = "all", produces = "application/json")
    public List<FlashcardSetSchedule> getFlashcardSets() {
        return setScheduler.getFlashcardSets();
    }

    @GetMapping(value = "due", produces = "application/json")
    public List<FlashcardSetSchedule> getFlashcardSetsDueForPractice() {
        return setScheduler.getFlashcardSetsDueForPractice();
    }

    @PostMapping(value = "save", consumes = "application/json")
    public boolean saveFlashcardSet(@RequestBody FlashcardSetSchedule flashcardSet) {
        return setScheduler.saveFlashcardSet(flashcardSet);
    }

    @PostMapping(value = "practiced")
    public void recordSetPractice(@RequestParam(value = "setId") String setId) {
        setScheduler.recordSetPractice(setId);
    }

    @DeleteMapping("{setId}")
    public boolean deleteFlashcardSet(@PathVariable("setId") String setId) {
        return setScheduler.deleteFlashcardSet(setId);
    }

    @GetMapping(value = "nextPracticeDate", produces = "application/json")
    public Instant getNextPracticeDate(@RequestParam(value = "frequency") String frequency,
                                       @RequestParam(value = "customDays", required = false) Integer customDays) {
        return setScheduler.calculateNextPracticeDate(PracticeFrequency.fromWireName(frequency), customDays);
    }

    @GetMapping(value = "newId", produces = "application/json")
    public String generateFlashcardSetId() {
        return setScheduler.generateFlashcardSetId();
    }
}
