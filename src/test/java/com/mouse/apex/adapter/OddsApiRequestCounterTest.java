package com.mouse.apex.adapter;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class OddsApiRequestCounterTest {

    @Test
    void tryAcquire_stopsAtLimit() {
        OddsApiRequestCounter counter = new OddsApiRequestCounter(2);

        assertThat(counter.tryAcquire()).isTrue();
        assertThat(counter.tryAcquire()).isTrue();
        assertThat(counter.tryAcquire()).isFalse();
        assertThat(counter.getUsed()).isEqualTo(2);
        assertThat(counter.getRemaining()).isZero();
    }

    @Test
    void syncUsed_andReset() {
        OddsApiRequestCounter counter = new OddsApiRequestCounter(500);

        counter.syncUsed(120);
        assertThat(counter.getRemaining()).isEqualTo(380);

        counter.reset();
        assertThat(counter.getUsed()).isZero();
        assertThat(counter.getLimit()).isEqualTo(500);
    }
}
