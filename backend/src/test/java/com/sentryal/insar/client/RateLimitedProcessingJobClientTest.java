package com.sentryal.insar.client;

import com.sentryal.insar.exception.RateLimitExceededException;
import com.sentryal.insar.exception.TransientRemoteException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

public class RateLimitedProcessingJobClientTest {

    @Mock
    private ProcessingJobClient delegate;

    private RateLimitedProcessingJobClient client;

    @BeforeEach
    public void setup() {
        MockitoAnnotations.openMocks(this);
        RateLimiter limiter = RateLimiter.of("test", RateLimiterConfig.custom()
                .limitForPeriod(2)
                .limitRefreshPeriod(Duration.ofHours(1))
                .timeoutDuration(Duration.ZERO)
                .build());
        client = new RateLimitedProcessingJobClient(delegate, limiter);
    }

    @Test
    public void testCallsBeyondLimitAreRefusedWithoutReachingDelegate() {
        when(delegate.status("remote-1")).thenReturn(RemoteStatusReport.of(RemoteJobStatus.RUNNING));

        client.status("remote-1");
        client.cancel("remote-1");
        RateLimitExceededException refused = assertThrows(RateLimitExceededException.class,
                () -> client.status("remote-1"));

        assertTrue(refused.getMessage().contains("status"));
        verify(delegate, times(1)).status("remote-1");
        verify(delegate, times(1)).cancel("remote-1");
    }

    @Test
    public void testDelegateErrorsPassThrough() {
        when(delegate.status("remote-1")).thenThrow(new TransientRemoteException("HTTP 502"));

        TransientRemoteException e = assertThrows(TransientRemoteException.class, () -> client.status("remote-1"));

        assertFalse(e instanceof RateLimitExceededException);
    }
}
