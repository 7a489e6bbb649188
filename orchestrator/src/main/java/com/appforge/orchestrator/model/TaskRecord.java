package com.appforge.orchestrator.model;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.UUID;

/**
 * Persistent view of one accepted submission.
 *
 * The orchestrator advances state as each step finishes and writes the
 * terminal outcome columns once, when the pipeline reaches NOTIFYING.
 *
 * DB table: tasks  (created by Flyway V1 migration)
 */
@Entity
@Table(name = "tasks")
public class TaskRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    // Not unique: resubmissions with the same identity get their own record
    // and converge on the same repository.
    @Column(name = "task_key", nullable = false, length = 64)
    private String taskKey;

    @Column(nullable = false)
    private String email;

    @Column(name = "task_name", nullable = false)
    private String taskName;

    @Column(nullable = false)
    private int round;

    @Column(nullable = false)
    private String nonce;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private TaskState state = TaskState.RECEIVED;

    // The immutable Task value, replayed by stalled-task recovery.
    @Column(name = "task_json", nullable = false, columnDefinition = "TEXT")
    private String taskJson;

    // ── Outcome (null until the pipeline reaches a terminal result) ─────────

    @Enumerated(EnumType.STRING)
    @Column(name = "outcome_status")
    private OutcomeStatus outcomeStatus;

    @Enumerated(EnumType.STRING)
    @Column(name = "error_kind")
    private ErrorKind errorKind;

    @Column(name = "error_detail", columnDefinition = "TEXT")
    private String errorDetail;

    @Column(name = "repository_name")
    private String repositoryName;

    @Column(name = "repository_url")
    private String repositoryUrl;

    @Column(name = "pages_url")
    private String pagesUrl;

    @Enumerated(EnumType.STRING)
    @Column(name = "pages_status")
    private PagesStatus pagesStatus;

    @Column(name = "commit_sha", length = 40)
    private String commitSha;

    @Column(nullable = false)
    private boolean notified = false;

    // ── Attempt counters (informational) ────────────────────────────────────

    @Column(name = "generation_attempts", nullable = false)
    private int generationAttempts = 0;

    @Column(name = "publish_attempts", nullable = false)
    private int publishAttempts = 0;

    @Column(name = "notify_attempts", nullable = false)
    private int notifyAttempts = 0;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt = Instant.now();

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt = Instant.now();

    // Touched on every state transition; recovery uses it to find dead runs.
    @Column(name = "heartbeat_at", nullable = false)
    private Instant heartbeatAt = Instant.now();

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    // ------------------------------------------------------------------
    // Constructors
    // ------------------------------------------------------------------

    protected TaskRecord() {}   // required by JPA

    public TaskRecord(Task task, String taskJson) {
        this.taskKey  = task.key();
        this.email    = task.email();
        this.taskName = task.task();
        this.round    = task.round();
        this.nonce    = task.nonce();
        this.taskJson = taskJson;
    }

    // ------------------------------------------------------------------
    // Outcome
    // ------------------------------------------------------------------

    public void applyOutcome(TaskOutcome outcome) {
        this.outcomeStatus = outcome.status();
        this.errorKind     = outcome.errorKind();
        this.errorDetail   = outcome.errorDetail();
        this.notified      = outcome.notified();
        Deployment d = outcome.deployment();
        if (d != null) {
            this.repositoryName = d.repositoryName();
            this.repositoryUrl  = d.repositoryUrl();
            this.pagesUrl       = d.pagesUrl();
            this.commitSha      = d.commitSha();
            this.pagesStatus    = d.pagesStatus();
        }
    }

    /**
     * The stored terminal outcome, rebuilt from its columns.
     *
     * @throws IllegalStateException when no outcome has been stored yet
     */
    public TaskOutcome storedOutcome() {
        if (outcomeStatus == null) {
            throw new IllegalStateException("Task " + id + " has no stored outcome");
        }
        Deployment d = outcomeStatus == OutcomeStatus.SUCCEEDED
                ? new Deployment(repositoryName, repositoryUrl, pagesUrl, commitSha, pagesStatus)
                : null;
        return new TaskOutcome(outcomeStatus, d, errorKind, errorDetail, notified);
    }

    // ------------------------------------------------------------------
    // Getters / setters
    // ------------------------------------------------------------------

    public UUID          getId()             { return id; }
    public String        getTaskKey()        { return taskKey; }
    public String        getEmail()          { return email; }
    public String        getTaskName()       { return taskName; }
    public int           getRound()          { return round; }
    public String        getNonce()          { return nonce; }
    public TaskState     getState()          { return state; }
    public String        getTaskJson()       { return taskJson; }
    public OutcomeStatus getOutcomeStatus()  { return outcomeStatus; }
    public ErrorKind     getErrorKind()      { return errorKind; }
    public String        getErrorDetail()    { return errorDetail; }
    public String        getRepositoryName() { return repositoryName; }
    public String        getRepositoryUrl()  { return repositoryUrl; }
    public String        getPagesUrl()       { return pagesUrl; }
    public PagesStatus   getPagesStatus()    { return pagesStatus; }
    public String        getCommitSha()      { return commitSha; }
    public boolean       isNotified()        { return notified; }
    public Instant       getCreatedAt()      { return createdAt; }
    public Instant       getUpdatedAt()      { return updatedAt; }
    public Instant       getHeartbeatAt()    { return heartbeatAt; }

    public int  getGenerationAttempts()      { return generationAttempts; }
    public int  getPublishAttempts()         { return publishAttempts; }
    public int  getNotifyAttempts()          { return notifyAttempts; }

    public void setState(TaskState state)            { this.state = state; }
    public void setHeartbeatAt(Instant t)            { this.heartbeatAt = t; }
    public void setRepositoryName(String v)          { this.repositoryName = v; }
    public void setGenerationAttempts(int v)         { this.generationAttempts = v; }
    public void setPublishAttempts(int v)            { this.publishAttempts = v; }
    public void setNotifyAttempts(int v)             { this.notifyAttempts = v; }
}
