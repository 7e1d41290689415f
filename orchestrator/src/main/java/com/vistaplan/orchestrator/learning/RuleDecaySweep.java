package com.vistaplan.orchestrator.learning;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Daily time-decay pass over all enabled rules. Reads also decay lazily, so
 * this only matters for rules nobody has looked at in a while.
 */
@Component
public class RuleDecaySweep {

    private static final Logger log = LoggerFactory.getLogger(RuleDecaySweep.class);

    private final ProgressiveLearningService learning;

    public RuleDecaySweep(ProgressiveLearningService learning) {
        this.learning = learning;
    }

    @Scheduled(cron = "${vistaplan.learning.decay-cron:0 15 3 * * *}")
    public void sweep() {
        int changed = learning.decayAll();
        log.info("Rule decay sweep finished: {} rules changed", changed);
    }
}
