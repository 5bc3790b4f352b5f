package club.ppmc.sessionhub.detect;

import static org.assertj.core.api.Assertions.assertThat;

import club.ppmc.sessionhub.detect.WaitingStateDetector.Transition;
import org.junit.jupiter.api.Test;

class WaitingStateDetectorTest {

    private static final String BEL = "\u0007";

    private final WaitingStateDetector detector = new WaitingStateDetector(200, 2_000);

    @Test
    void bellStartsWaitingOnce() {
        assertThat(detector.onOutput("Allow this edit?" + BEL, 1_000)).isEqualTo(Transition.STARTED_WAITING);
        assertThat(detector.onOutput(BEL, 1_100)).isEqualTo(Transition.NONE);
        assertThat(detector.isWaiting()).isTrue();
    }

    @Test
    void oscTitleDoesNotStartWaiting() {
        assertThat(detector.onOutput("\u001b]0;claude\u0007", 1_000)).isEqualTo(Transition.NONE);
        assertThat(detector.isWaiting()).isFalse();
    }

    @Test
    void oscTitleSplitAcrossReadsDoesNotStartWaiting() {
        assertThat(detector.onOutput("\u001b]0;claude: working on task", 1_000)).isEqualTo(Transition.NONE);
        assertThat(detector.onOutput(BEL + "more output", 1_050)).isEqualTo(Transition.NONE);
        assertThat(detector.isWaiting()).isFalse();
    }

    @Test
    void bellAfterSplitOscStillStartsWaiting() {
        detector.onOutput("\u001b]0;cla", 1_000);

        assertThat(detector.onOutput("ude" + BEL + "Allow?" + BEL, 1_050)).isEqualTo(Transition.STARTED_WAITING);
    }

    @Test
    void outputInsideGraceWindowIsNotCounted() {
        detector.onOutput(BEL, 1_000);

        assertThat(detector.onOutput("x".repeat(500), 2_500)).isEqualTo(Transition.NONE);
        assertThat(detector.isWaiting()).isTrue();
        assertThat(detector.getBytesSinceBell()).isZero();
    }

    @Test
    void clearsAfterEnoughVisibleOutputPastGrace() {
        detector.onOutput(BEL, 1_000);

        assertThat(detector.onOutput("y".repeat(150), 3_500)).isEqualTo(Transition.NONE);
        assertThat(detector.onOutput("\u001b[2K" + "z".repeat(50), 3_600)).isEqualTo(Transition.STOPPED_WAITING);
        assertThat(detector.isWaiting()).isFalse();
    }

    @Test
    void whitespaceRedrawDoesNotClear() {
        detector.onOutput(BEL, 1_000);

        detector.onOutput(" ".repeat(1_000) + "\r\n".repeat(100), 5_000);

        assertThat(detector.isWaiting()).isTrue();
    }

    @Test
    void seedAppliesGraceWindow() {
        detector.seed(true, 10_000, 5_000);

        assertThat(detector.onOutput("a".repeat(400), 12_000)).isEqualTo(Transition.NONE);
        assertThat(detector.isWaiting()).isTrue();
        assertThat(detector.onOutput("a".repeat(400), 15_000)).isEqualTo(Transition.STOPPED_WAITING);
    }
}
