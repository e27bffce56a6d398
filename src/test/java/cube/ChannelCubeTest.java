package cube;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ChannelCubeTest {

    private static final double PLANCK = 6.62607015e-34;
    private static final double BOLTZMANN = 1.380649e-23;
    private static final double SPEED_OF_LIGHT = 2.99792458e8;
    private static final double NU = 230.538e9;

    private static ChannelCube cube() {
        return new ChannelCube(new double[][][]{{{1, 2, 3}, {4, 5, 6}}, {{0, 0, 0}, {0, 0, 0}}},
                new double[]{-1, 1}, 0.05, 0.25, 0.2, NU);
    }

    @Test
    void testShapeAndMetadata() {
        ChannelCube cube = cube();

        assertEquals(2, cube.getChannelCount());
        assertEquals(2, cube.getRows());
        assertEquals(3, cube.getColumns());
        assertEquals(1.0, cube.getVelocity(1));
        assertEquals(0.05, cube.getPixelScale());
        assertEquals(0.25, cube.getBmaj());
        assertEquals(6.0, cube.getChannel(0)[1][2]);
    }

    @Test
    void testChannelIsACopy() {
        ChannelCube cube = cube();

        cube.getChannel(0)[0][0] = 99;

        assertEquals(1.0, cube.getChannel(0)[0][0]);
    }

    @Test
    void testInvalidCubes() {
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(new double[0][][], new double[0], 0.05, 0.25, 0.2, NU));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(new double[][][]{{{1, 2}}, {{1, 2}, {3, 4}}}, new double[]{0, 1}, 0.05, 0.25, 0.2, NU));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(new double[][][]{{{1, 2}, {3}}}, new double[]{0}, 0.05, 0.25, 0.2, NU));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(new double[][][]{{{1, 2}}}, new double[]{0, 1}, 0.05, 0.25, 0.2, NU));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(new double[][][]{{{1, 2}}}, new double[]{0}, 0, 0.25, 0.2, NU));
    }

    @Test
    void testPlanckInversion() {
        ChannelCube cube = cube();
        double temperature = 30.0;

        // Planck intensity of a 30 K blackbody, in Jy/beam
        double x = PLANCK * NU / (BOLTZMANN * temperature);
        double intensity = 2 * PLANCK * NU * NU * NU / (SPEED_OF_LIGHT * SPEED_OF_LIGHT) / Math.expm1(x);
        double jyBeam = intensity * cube.beamArea() / 1e-26;

        assertEquals(temperature, cube.jyBeamToTb(jyBeam), 1e-9);
    }

    @Test
    void testTemperatureSignAndMonotonicity() {
        ChannelCube cube = cube();

        assertEquals(0.0, cube.jyBeamToTb(0.0));
        assertEquals(-cube.jyBeamToTb(0.1), cube.jyBeamToTb(-0.1), 1e-12);
        assertTrue(cube.jyBeamToTb(0.2) > cube.jyBeamToTb(0.1));
        assertTrue(cube.jyBeamToTb(0.1) > 0);
    }

    @Test
    void testRestFrequencyIsRequired() {
        double[][][] channels = {{{1}}};
        double[] velocities = {0};

        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(channels, velocities, 0.05, 0.25, 0.2, 0));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(channels, velocities, 0.05, 0.25, 0.2, -NU));
        assertThrows(IllegalArgumentException.class,
                () -> new ChannelCube(channels, velocities, 0.05, 0.25, 0.2, Double.NaN));
    }
}
