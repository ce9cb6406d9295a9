package com.taggernews.ingest.service;

import com.taggernews.ingest.model.JobName;
import com.taggernews.ingest.model.JobRunSummary;

import java.time.Duration;

/**
 * A recurring job body. Run bookkeeping (begin/end, failure counts) belongs to the scheduler.
 */
public interface ScheduledJob {

    JobName name();

    Duration interval();

    JobRunSummary run();
}
