package com.flagship.mining_ledger.entitlement;

import com.flagship.mining_ledger.config.ExecutorConfig;
import com.flagship.mining_ledger.config.LedgerProperties;
import com.flagship.mining_ledger.exception.InfrastructureException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link PaymentVerifier} calls with a bounded wait.
 *
 * A rejected proof is a business answer ({@code false}). A slow, failing or
 * overloaded verifier is an infrastructure failure and raises
 * {@link InfrastructureException}, so callers never mistake an outage for a
 * bad payment.
 */
@Service
@Slf4j
public class PaymentVerificationService {

    private final PaymentVerifier verifier;
    private final Executor executor;
    private final Duration timeout;

    public PaymentVerificationService(PaymentVerifier verifier,
                                      @Qualifier(ExecutorConfig.PAYMENT_VERIFICATION_EXECUTOR) Executor executor,
                                      LedgerProperties properties) {
        this.verifier = verifier;
        this.executor = executor;
        this.timeout = properties.getPaymentVerification().getTimeout();
    }

    public boolean verify(String paymentProof, BigDecimal expectedAmount) {
        CompletableFuture<Boolean> call;
        try {
            call = CompletableFuture.supplyAsync(() -> verifier.verify(paymentProof, expectedAmount), executor);
        } catch (RejectedExecutionException e) {
            throw new InfrastructureException("Payment verification is overloaded", e);
        }

        try {
            return Boolean.TRUE.equals(call.get(timeout.toMillis(), TimeUnit.MILLISECONDS));
        } catch (TimeoutException e) {
            call.cancel(true);
            log.error("Payment verification timed out after {}ms", timeout.toMillis());
            throw new InfrastructureException("Payment verification timed out", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InfrastructureException("Interrupted while verifying payment", e);
        } catch (ExecutionException e) {
            log.error("Payment verification failed: {}", e.getCause().getMessage());
            throw new InfrastructureException("Payment verification failed", e.getCause());
        }
    }
}
