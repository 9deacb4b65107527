package com.ryuqq.jobstore.core.document;

/**
 * Secondary index from a job id to the partition currently holding the job.
 *
 * <p>Job documents are partitioned by queue, so a job id alone does not locate its
 * document. One index entry per job, under the fixed {@code job-index} partition, turns
 * that lookup into two point reads instead of a cross-partition query.</p>
 *
 * @author JobStore Team
 * @since 1.0.0
 */
public class JobIndexDocument extends BaseDocument {

    private String jobId;
    private String queueName;
    private String jobPartitionKey;

    public JobIndexDocument() {
    }

    public JobIndexDocument(String jobId, String queueName, String jobPartitionKey) {
        setJobId(jobId);
        this.queueName = queueName;
        this.jobPartitionKey = jobPartitionKey;
    }

    public static String idFor(String jobId) {
        return "jobIndex:" + jobId;
    }

    @Override
    public DocumentKind kind() {
        return DocumentKind.JOB_INDEX;
    }

    @Override
    public String partitionScope() {
        return null;
    }

    public String getJobId() {
        return jobId;
    }

    public void setJobId(String jobId) {
        this.jobId = jobId;
        setId(jobId == null ? null : idFor(jobId));
    }

    public String getQueueName() {
        return queueName;
    }

    public void setQueueName(String queueName) {
        this.queueName = queueName;
    }

    public String getJobPartitionKey() {
        return jobPartitionKey;
    }

    public void setJobPartitionKey(String jobPartitionKey) {
        this.jobPartitionKey = jobPartitionKey;
    }
}
