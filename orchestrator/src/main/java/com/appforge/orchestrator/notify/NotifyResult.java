package com.appforge.orchestrator.notify;

/**
 * What happened when the outcome was posted to the evaluation URL.
 *
 * @param delivered whether some attempt got a 2xx answer
 * @param attempts  POSTs made (0 when the task had no evaluation URL)
 * @param lastError reason the last failed attempt failed, null when delivered
 */
public record NotifyResult(boolean delivered, int attempts, String lastError) {

    public static NotifyResult delivered(int attempts) {
        return new NotifyResult(true, attempts, null);
    }

    public static NotifyResult undelivered(int attempts, String lastError) {
        return new NotifyResult(false, attempts, lastError);
    }
}
