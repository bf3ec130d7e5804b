package org.Aayush.pathfinding.fee;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Mediation Fee Tests")
class MediationFeeTest {

    @Test
    @DisplayName("Flat fees on both sides add up")
    void testFlatBothSides() {
        MediationFee fee = MediationFee.backward(FeeSchedule.of(1, 0), 100, FeeSchedule.of(1, 0), 100, 10);
        assertEquals(new MediationFee(1, 1), fee);
        assertEquals(2L, fee.total());
        assertTrue(fee.isDefined());
    }

    @Test
    @DisplayName("Receiver part is charged on the amount including the sender part")
    void testReceiverSeesSenderFee() {
        FeeSchedule schedule = FeeSchedule.of(10, FeeSchedule.perChannelProportional(100_000));
        MediationFee fee = MediationFee.backward(schedule, 10_000, schedule, 10_000, 1_000);
        assertEquals(58L, fee.senderFee());
        assertEquals(63L, fee.receiverFee());
        assertEquals(121L, fee.total());
    }

    @Test
    @DisplayName("Either side off-table makes the hop undefined")
    void testUndefined() {
        FeeSchedule narrow = FeeSchedule.of(0, 0, ImbalancePenalty.ofPairs(0, 0, 80, 200));
        assertSame(MediationFee.UNDEFINED, MediationFee.backward(narrow, 100, FeeSchedule.ZERO, 100, 10));
        assertSame(MediationFee.UNDEFINED, MediationFee.backward(FeeSchedule.ZERO, 100, narrow, 100, 10));
        assertFalse(MediationFee.UNDEFINED.isDefined());
        assertThrows(IllegalStateException.class, MediationFee.UNDEFINED::total);
    }

    @Test
    void testNullSchedulesRejected() {
        assertThrows(NullPointerException.class, () -> MediationFee.backward(null, 0, FeeSchedule.ZERO, 0, 1));
        assertThrows(NullPointerException.class, () -> MediationFee.backward(FeeSchedule.ZERO, 0, null, 0, 1));
    }
}
