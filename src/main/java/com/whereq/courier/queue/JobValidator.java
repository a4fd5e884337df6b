package com.whereq.courier.queue;

import com.whereq.courier.exception.JobValidationException;
import com.whereq.courier.model.Job;
import org.springframework.stereotype.Component;

/**
 * Rejects jobs that could never be answered or delivered
 */
@Component
public class JobValidator {

    /**
     * Validate a job
     *
     * @param job job to check
     * @return the same job
     * @throws JobValidationException when a required field is missing
     */
    public Job validate(Job job) {
        if (job == null) {
            throw new JobValidationException("Job body is missing");
        }
        if (job.getQuestionText() == null || job.getQuestionText().isBlank()) {
            throw new JobValidationException("Missing required field 'questionText'");
        }
        if (!job.isDeliverable()) {
            throw new JobValidationException("Either 'channelId' or 'responseUrl' must be specified");
        }
        return job;
    }
}
