package com.gt.studyscheduler.task;

import com.gt.studyscheduler.model.FlashcardSetSchedule;
import com.gt.studyscheduler.practiceSet.SetScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class PracticeReminderTask {

    private static final Logger log = LoggerFactory.getLogger(PracticeReminderTask.class);

    private final SetScheduler setScheduler;

    public PracticeReminderTask(SetScheduler setScheduler) {
        this.setScheduler = setScheduler;
    }

    @Scheduled(cron = "${studyscheduler.practice.reminderCron:0 0 8 * * *}", zone = "${studyscheduler.timezone:UTC}")
    public void reportSetsDueForPractice() {
        List<FlashcardSetSchedule> dueSets = setScheduler.getFlashcardSetsDueForPractice();

        if (dueSets.isEmpty()) {
            log.info("No flashcard sets due for practice.");
        } else {
            log.info("{} flashcard sets due for practice: {}", dueSets.size(),
                    dueSets.stream().map(FlashcardSetSchedule::setId).toList());
        }
    }
}
