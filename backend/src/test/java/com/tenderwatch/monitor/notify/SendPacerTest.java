package com.tenderwatch.monitor.notify;

import com.tenderwatch.monitor.service.CancellationToken;
import com.tenderwatch.monitor.service.RunCancelledException;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SendPacerTest {

    @Test
    void laterTicketWaitsForEarlierRelease() throws Exception {
        SendPacer pacer = SendPacer.unpaced();
        CancellationToken token = new CancellationToken();

        CompletableFuture<Void> second = CompletableFuture.runAsync(() -> {
            try {
                pacer.awaitTurn(1, token);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });

        Thread.sleep(150);
        assertThat(second).isNotDone();
        pacer.release(0);
        second.get(2, TimeUnit.SECONDS);
        assertThat(second).isDone();
    }

    @Test
    void outOfOrderReleasesAdvanceTogether() throws Exception {
        SendPacer pacer = SendPacer.unpaced();
        pacer.release(1);
        pacer.release(1);
        pacer.release(0);

        pacer.awaitTurn(2, CancellationToken.none());
    }

    @Test
    void waitingTicketGivesUpWhenCancelled() {
        SendPacer pacer = SendPacer.unpaced();
        CancellationToken token = new CancellationToken();
        token.cancel();

        assertThatThrownBy(() -> pacer.awaitTurn(3, token)).isInstanceOf(RunCancelledException.class);
    }

    @Test
    void slotsAreSpacedByInterval() throws Exception {
        SendPacer pacer = new SendPacer(40);

        long start = System.nanoTime();
        pacer.awaitSlot();
        pacer.awaitSlot();
        pacer.awaitSlot();
        long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

        assertThat(pacer.intervalMs()).isEqualTo(40);
        assertThat(elapsedMs).isGreaterThanOrEqualTo(75);
    }
}
