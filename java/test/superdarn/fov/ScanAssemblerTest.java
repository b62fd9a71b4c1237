package superdarn.fov;

import org.junit.jupiter.api.Test;
import superdarn.RadarFixtures;
import superdarn.fov.model.RadarBeam;
import superdarn.fov.model.ScanWindow;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

class ScanAssemblerTest {

    private static RadarBeam beam(int beamNumber, long seconds) {
        return RadarFixtures.beam(beamNumber, RadarFixtures.T0.plusSeconds(seconds)).build();
    }

    @Test
    void directionReversalStartsNewScan() {
        ScanAssembler assembler = new ScanAssembler();
        for (int b = 0; b < 4; b++) {
            assertThat(assembler.add(beam(b, 3L * b))).isNull();
        }

        ScanWindow completed = assembler.add(beam(0, 12));

        assertThat(completed).isNotNull();
        assertThat(completed.size()).isEqualTo(4);
        assertThat(completed.getScanTime()).isEqualTo(RadarFixtures.T0);
        assertThat(assembler.finish().size()).isEqualTo(1);
        assertThat(assembler.finish()).isNull();
    }

    @Test
    void descendingScanIsAccepted() {
        ScanAssembler assembler = new ScanAssembler();
        assembler.add(beam(15, 0));
        assembler.add(beam(14, 3));
        assembler.add(beam(12, 9));

        assertThat(assembler.finish().size()).isEqualTo(3);
    }

    @Test
    void gapsAndProgramChangesEndTheScan() {
        ScanWindow window = new ScanWindow(beam(3, 0));

        assertThat(window.tryAdd(beam(4, 60), ScanAssembler.MAX_BEAM_STEP)).isFalse();
        assertThat(window.tryAdd(beam(8, 3), ScanAssembler.MAX_BEAM_STEP)).isFalse();
        assertThat(window.tryAdd(beam(3, 3), ScanAssembler.MAX_BEAM_STEP)).isFalse();
        Instant t = RadarFixtures.T0.plusSeconds(3);
        assertThat(window.tryAdd(RadarFixtures.beam(4, t).programId(157).build(), ScanAssembler.MAX_BEAM_STEP))
            .isFalse();
        assertThat(window.tryAdd(beam(4, 3), ScanAssembler.MAX_BEAM_STEP)).isTrue();
        assertThat(window.getBeams()).hasSize(2);
    }

    @Test
    void emptyStreamHasNoScan() {
        assertThat(new ScanAssembler().finish()).isNull();
    }
}
