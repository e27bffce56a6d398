package surface;

import cube.ChannelCube;
import cube.ChannelRotator;
import nu.pattern.OpenCV;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * The synthetic disk observed with its major axis vertical (PA = 0), needs OpenCV
 */
class RotatedDiskTest {

    @BeforeAll
    static void setUp() {
        // Load OpenCV library
        OpenCV.loadLocally();
    }

    @Test
    void testPositionAngleZero() {
        ChannelRotator rotator = new ChannelRotator();
        double[][][] aligned = SyntheticDisk.channels();
        double[][][] onSky = new double[aligned.length][][];
        for (int iv = 0; iv < aligned.length; iv++) {
            // undone by the detector, which turns each channel by PA - 90
            onSky[iv] = rotator.rotate(aligned[iv], 90);
        }
        ChannelCube reference = SyntheticDisk.cube(aligned);
        ChannelCube cube = SyntheticDisk.cube(onSky);

        MolecularSurface expected = MolecularSurface.extract(reference, SyntheticDisk.geometry(null),
                SyntheticDisk.detector(), new Deprojector());
        SurfaceDetector detector = SyntheticDisk.detector();
        detector.setKeepRotatedChannels(true);
        MolecularSurface surface = MolecularSurface.extract(cube, SyntheticDisk.geometry(0.0),
                detector, new Deprojector());

        assertArrayEquals(expected.getDetection().counts(), surface.getDetection().counts());
        assertEquals(aligned.length, surface.getDetection().rotatedChannels.size());

        Deprojector.DeprojectionResult want = expected.getDeprojection();
        Deprojector.DeprojectionResult got = surface.getDeprojection();
        assertTrue(got.size() > 0);
        assertEquals(want.size(), got.size());
        assertArrayEquals(want.getR(), got.getR(), 1e-6);
        assertArrayEquals(want.getH(), got.getH(), 1e-6);
        assertArrayEquals(want.getV(), got.getV(), 1e-6);
    }
}
