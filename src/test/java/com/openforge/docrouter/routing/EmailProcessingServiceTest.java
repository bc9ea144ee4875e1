package com.openforge.docrouter.routing;

import com.openforge.docrouter.domain.AssetType;
import com.openforge.docrouter.routing.dto.Attachment;
import com.openforge.docrouter.routing.dto.EmailMessage;
import com.openforge.docrouter.routing.dto.EmailRoutingResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class EmailProcessingServiceTest {

    private static final RoutingProperties PROPS = new RoutingProperties(
            0.85, 0.65, 0.40, 0.6, 2, 3, 1, "to_be_reviewed", "needs_review");

    private final RoutingService routingService = mock(RoutingService.class);
    private final Set<String> committed = ConcurrentHashMap.newKeySet();
    private ExecutorService emailPool;
    private ExecutorService attachmentPool;
    private EmailProcessingService service;

    @BeforeEach
    void setUp() {
        emailPool      = Executors.newFixedThreadPool(2);
        attachmentPool = Executors.newFixedThreadPool(3);
        service        = new EmailProcessingService(routingService, emailPool, attachmentPool, PROPS);

        when(routingService.classifyAttachment(any(EmailMessage.class), any(Attachment.class), any(BooleanSupplier.class)))
                .thenAnswer(inv -> {
                    Attachment attachment = inv.getArgument(1);
                    BooleanSupplier permit = inv.getArgument(2);
                    switch (attachment.filename()) {
                        case "scan_stuck.pdf" -> Thread.sleep(5_000);
                        case "slow_commit.pdf" -> {
                            if (!permit.getAsBoolean()) throw new CancellationException("abandoned");
                            committed.add(attachment.filename());
                            sleepThroughInterrupts(1_200);
                            return stored(attachment.filename());
                        }
                        default -> { }
                    }
                    if (!permit.getAsBoolean()) throw new CancellationException("abandoned");
                    committed.add(attachment.filename());
                    return stored(attachment.filename());
                });
    }

    @AfterEach
    void tearDown() {
        emailPool.shutdownNow();
        attachmentPool.shutdownNow();
    }

    private static void sleepThroughInterrupts(long millis) {
        long deadline = System.currentTimeMillis() + millis;
        while (System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(Math.max(1, deadline - System.currentTimeMillis()));
            } catch (InterruptedException ignored) {
                // the commit is not interruptible
            }
        }
    }

    private static Attachment attachment(String filename) {
        return new Attachment(filename, "content".getBytes(StandardCharsets.UTF_8));
    }

    private static RoutingDecision stored(String filename) {
        return new RoutingDecision(filename, RoutingStatus.STORED, RoutingBand.HIGH, "I3", AssetType.PRIVATE_CREDIT,
                "loan_documents", 0.9, 0.9, 0.9, false, null, "I3/loan_documents", null, false,
                List.of(), List.of());
    }

    @Test
    void timeoutReportsOnlyUncommittedAttachmentsAsTimedOut() {
        EmailMessage email = new EmailMessage("ops@lender.test", "i3 pack", "",
                List.of(attachment("quick.pdf"), attachment("scan_stuck.pdf"), attachment("slow_commit.pdf")));

        EmailRoutingResult result = service.processEmail(email);

        Set<String> decided = result.decisions().stream().map(RoutingDecision::filename).collect(Collectors.toSet());
        assertEquals(Set.of("quick.pdf", "slow_commit.pdf"), decided);
        assertEquals(1, result.failures().size());
        assertEquals("scan_stuck.pdf", result.failures().get(0).filename());
        assertEquals("timed out", result.failures().get(0).error());
        assertEquals(decided, committed);
    }

    @Test
    void emailWithinTimeoutReturnsEveryDecision() {
        EmailMessage email = new EmailMessage("ops@lender.test", "i3 pack", "",
                List.of(attachment("a.pdf"), attachment("b.pdf")));

        EmailRoutingResult result = service.processEmail(email);

        assertEquals(2, result.decisions().size());
        assertTrue(result.failures().isEmpty());
    }
}
