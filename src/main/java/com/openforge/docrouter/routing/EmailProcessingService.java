package com.openforge.docrouter.routing;

import com.openforge.docrouter.routing.dto.Attachment;
import com.openforge.docrouter.routing.dto.EmailMessage;
import com.openforge.docrouter.routing.dto.EmailRoutingResult;
import com.openforge.docrouter.routing.dto.EmailRoutingResult.AttachmentFailure;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.FutureTask;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes every attachment of an email on the worker pools.
 *
 * Emails run on {@code emailExecutor} (max-concurrent-emails threads); each
 * email fans its attachments out to {@code attachmentExecutor} with at most
 * max-concurrent-attachments in flight, enforced by a per-email semaphore.
 *
 * Each attachment holds a slot that is claimed exactly once, either by its
 * worker when it is about to commit or by the timeout when the email runs
 * out of time. On timeout, attachments already committed (or committing) are
 * reported with their decisions; only the ones abandoned before any write
 * are reported as timed out.
 */
@Slf4j
@Service
public class EmailProcessingService {

    private final RoutingService    routingService;
    private final ExecutorService   emailExecutor;
    private final ExecutorService   attachmentExecutor;
    private final RoutingProperties properties;

    public EmailProcessingService(RoutingService routingService,
                                  @Qualifier("emailExecutor") ExecutorService emailExecutor,
                                  @Qualifier("attachmentExecutor") ExecutorService attachmentExecutor,
                                  RoutingProperties properties) {
        this.routingService     = routingService;
        this.emailExecutor      = emailExecutor;
        this.attachmentExecutor = attachmentExecutor;
        this.properties         = properties;
    }

    public EmailRoutingResult processEmail(EmailMessage email) {
        if (email.attachments().isEmpty()) {
            return new EmailRoutingResult(List.of(), List.of());
        }
        List<AttachmentSlot> slots = email.attachments().stream().map(AttachmentSlot::new).toList();
        Future<EmailRoutingResult> task;
        try {
            task = emailExecutor.submit(() -> routeAttachments(email, slots));
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("email worker pool is saturated", e);
        }
        try {
            return task.get(properties.emailTimeoutSeconds(), TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            slots.forEach(AttachmentSlot::abandon);
            task.cancel(true);
            log.warn("[Route] Email '{}' exceeded {} s, cancelled", email.subject(), properties.emailTimeoutSeconds());
            return timedOut(email, slots);
        } catch (InterruptedException e) {
            slots.forEach(AttachmentSlot::abandon);
            task.cancel(true);
            Thread.currentThread().interrupt();
            throw new CancellationException("email processing interrupted");
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) throw runtime;
            throw new IllegalStateException("email processing failed", e.getCause());
        }
    }

    private EmailRoutingResult routeAttachments(EmailMessage email, List<AttachmentSlot> slots)
            throws InterruptedException {
        Semaphore permits = new Semaphore(Math.max(1, properties.maxConcurrentAttachments()));
        try {
            for (AttachmentSlot slot : slots) {
                permits.acquire();
                try {
                    FutureTask<RoutingDecision> work = new FutureTask<>(() -> {
                        try {
                            return routingService.classifyAttachment(email, slot.attachment, slot::beginCommit);
                        } finally {
                            permits.release();
                        }
                    });
                    slot.future = work;
                    attachmentExecutor.execute(work);
                } catch (RejectedExecutionException e) {
                    permits.release();
                    throw e;
                }
            }
            return collect(email, slots);
        } catch (InterruptedException | RuntimeException e) {
            slots.forEach(AttachmentSlot::abandon);
            throw e;
        }
    }

    private EmailRoutingResult collect(EmailMessage email, List<AttachmentSlot> slots)
            throws InterruptedException {
        List<RoutingDecision> decisions = new ArrayList<>();
        List<AttachmentFailure> failures = new ArrayList<>();
        for (AttachmentSlot slot : slots) {
            String filename = slot.attachment.filename();
            try {
                decisions.add(slot.future.get());
            } catch (ExecutionException e) {
                failures.add(failure(filename, e));
            } catch (CancellationException e) {
                failures.add(new AttachmentFailure(filename, "cancelled"));
            }
        }
        log.info("[Route] Email '{}' routed: {} decision(s), {} failure(s)",
                email.subject(), decisions.size(), failures.size());
        return new EmailRoutingResult(decisions, failures);
    }

    private EmailRoutingResult timedOut(EmailMessage email, List<AttachmentSlot> slots) {
        List<RoutingDecision> decisions = new ArrayList<>();
        List<AttachmentFailure> failures = new ArrayList<>();
        for (AttachmentSlot slot : slots) {
            String filename = slot.attachment.filename();
            if (slot.state.get() == AttachmentSlot.ABANDONED) {
                failures.add(new AttachmentFailure(filename, "timed out"));
                continue;
            }
            // claimed by its worker: the commit runs to completion
            try {
                decisions.add(slot.future.get(properties.emailTimeoutSeconds(), TimeUnit.SECONDS));
            } catch (ExecutionException e) {
                failures.add(failure(filename, e));
            } catch (TimeoutException | CancellationException e) {
                log.error("[Route] Attachment {} is still committing after the email timed out", filename);
                failures.add(new AttachmentFailure(filename, "commit did not finish"));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                failures.add(new AttachmentFailure(filename, "interrupted"));
            }
        }
        log.info("[Route] Email '{}' timed out: {} decision(s) kept, {} failure(s)",
                email.subject(), decisions.size(), failures.size());
        return new EmailRoutingResult(decisions, failures);
    }

    private static AttachmentFailure failure(String filename, ExecutionException e) {
        Throwable cause = e.getCause() == null ? e : e.getCause();
        log.error("[Route] Attachment {} failed: {}", filename, cause.getMessage());
        return new AttachmentFailure(filename, cause.getMessage());
    }

    private static final class AttachmentSlot {

        static final int OPEN       = 0;
        static final int COMMITTING = 1;
        static final int ABANDONED  = 2;

        final Attachment attachment;
        final AtomicInteger state = new AtomicInteger(OPEN);
        volatile Future<RoutingDecision> future;

        AttachmentSlot(Attachment attachment) {
            this.attachment = attachment;
        }

        boolean beginCommit() {
            return state.compareAndSet(OPEN, COMMITTING);
        }

        void abandon() {
            if (state.compareAndSet(OPEN, ABANDONED)) {
                Future<RoutingDecision> f = future;
                if (f != null) f.cancel(true);
            }
        }
    }
}
