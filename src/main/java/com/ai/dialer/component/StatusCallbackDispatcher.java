package com.ai.dialer.component;

import com.ai.dialer.service.ParallelDialService;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;

/**
 * Moves provider status callbacks off the webhook thread. Callbacks for the same group run one
 * after another in arrival order; different groups run in parallel on the shared executor.
 */
@Component
public class StatusCallbackDispatcher {

    private static final Logger log = LoggerFactory.getLogger(StatusCallbackDispatcher.class);

    private static final String UNGROUPED = "";

    private final ParallelDialService parallelDialService;
    private final Executor executor;
    private final Map<String, CompletableFuture<Void>> tails = new ConcurrentHashMap<>();

    public StatusCallbackDispatcher(ParallelDialService parallelDialService,
                                    @Qualifier("callbackExecutor") Executor executor) {
        this.parallelDialService = parallelDialService;
        this.executor = executor;
    }

    /**
     * Queues a callback behind earlier callbacks of the same group.
     *
     * @param groupIdHint group named in the callback URL, for calls not mapped yet
     * @return completes once this callback has been applied
     */
    public CompletableFuture<Void> dispatch(String callSid, String callStatus, String answeredBy, String groupIdHint) {
        String groupId = parallelDialService.getGroupIdForCall(callSid)
                .or(() -> Optional.ofNullable(StringUtils.trimToNull(groupIdHint)))
                .orElse(UNGROUPED);
        Runnable task = () -> process(groupId, callSid, callStatus, answeredBy, groupIdHint);

        CompletableFuture<Void> next = tails.compute(groupId, (key, tail) -> tail == null
                ? CompletableFuture.runAsync(task, executor)
                : tail.exceptionally(e -> null).thenRunAsync(task, executor));
        next.whenComplete((ignored, error) -> tails.remove(groupId, next));
        return next;
    }

    private void process(String groupId, String callSid, String callStatus, String answeredBy, String groupIdHint) {
        MDC.put("groupId", groupId);
        MDC.put("callSid", callSid);
        try {
            parallelDialService.handleStatusCallback(callSid, callStatus, answeredBy, groupIdHint);
        } catch (RuntimeException e) {
            log.error("Status callback {} for {} failed", callStatus, callSid, e);
        } finally {
            MDC.remove("groupId");
            MDC.remove("callSid");
        }
    }

    int pendingGroups() {
        return tails.size();
    }
}
