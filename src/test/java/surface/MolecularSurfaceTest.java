package surface;

import cube.ChannelCube;
import nu.pattern.OpenCV;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Detection followed by deprojection on a synthetic flared disk
 */
class MolecularSurfaceTest {

    @BeforeAll
    static void setUp() {
        OpenCV.loadLocally();
    }

    @Test
    void testSyntheticDisk() {
        ChannelCube cube = SyntheticDisk.cube();

        MolecularSurface surface = MolecularSurface.extract(cube, SyntheticDisk.geometry(null),
                SyntheticDisk.detector(), new Deprojector());

        int[] counts = surface.getDetection().counts();
        assertEquals(5, counts.length);
        for (int iv = 0; iv < counts.length; iv++) {
            if (iv != SyntheticDisk.SYSTEMIC_CHANNEL) {
                assertTrue(counts[iv] >= 5, "channel " + iv + " has " + counts[iv] + " points");
            }
        }

        Deprojector.DeprojectionResult result = surface.getDeprojection();
        assertTrue(result.size() > 0);
        assertEquals(surface.getDetection().totalPoints(), result.getValid().length);

        double[] r = result.getR();
        double[] h = result.getH();
        double[] v = result.getV();
        double[] tb = result.getTb();
        int[] channel = result.getChannel();

        LinearFit heightProfile = new LinearFit();
        double sumV = 0;
        for (int k = 0; k < result.size(); k++) {
            assertTrue(h[k] > 0);
            assertTrue(Double.isFinite(v[k]));
            assertNotEquals(SyntheticDisk.SYSTEMIC_CHANNEL, channel[k]);
            assertTrue(tb[k] > 0);
            assertEquals(SyntheticDisk.V_ROT, v[k], 0.3);
            heightProfile.addPoint(r[k], h[k]);
            sumV += v[k];
        }
        assertTrue(sumV >= 0);

        // h grows with r as injected
        assertEquals(SyntheticDisk.FLARING, heightProfile.getSlope(), 0.03);
        assertEquals(0, heightProfile.getOffset(), 0.05);
    }

    @Test
    void testMissingInclinationFailsBeforeDetection() {
        DiskGeometry geometry = DiskGeometry.builder()
                .star(SyntheticDisk.X_STAR, SyntheticDisk.Y_STAR)
                .systemicVelocity(0.0)
                .build();

        assertThrows(IllegalArgumentException.class,
                () -> MolecularSurface.extract(SyntheticDisk.cube(), geometry));
    }

    @Test
    void testMissingRestFrequencyFailsBeforeDetection() {
        double[][][] channels = SyntheticDisk.channels();

        // the cube itself refuses the value, so no channel is ever scanned
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(channels, SyntheticDisk.VELOCITIES, SyntheticDisk.PIXEL_SCALE,
                        SyntheticDisk.BEAM, SyntheticDisk.BEAM, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(channels, SyntheticDisk.VELOCITIES, SyntheticDisk.PIXEL_SCALE,
                        SyntheticDisk.BEAM, SyntheticDisk.BEAM, Double.NaN));
    }

    @Test
    void testResultArraysAreCopies() {
        MolecularSurface surface = MolecularSurface.extract(SyntheticDisk.cube(), SyntheticDisk.geometry(null),
                SyntheticDisk.detector(), new Deprojector());
        Deprojector.DeprojectionResult result = surface.getDeprojection();
        assertTrue(result.size() > 0);

        double h0 = result.getH()[0];
        result.getH()[0] = -1;
        result.getR()[0] = -1;
        result.getValid()[0] = false;
        assertEquals(h0, result.getH()[0], 0);
        assertTrue(result.getR()[0] > 0);

        SurfaceDetector.ChannelResult channel = surface.getDetection().channels.get(0);
        assertTrue(channel.n > 0);
        int x0 = channel.getX()[0];
        double yNear0 = channel.getYNear()[0];
        channel.getX()[0] = -1;
        channel.getYNear()[0] = -1;
        assertEquals(x0, channel.getX()[0]);
        assertEquals(yNear0, channel.getYNear()[0], 0);
    }
}
