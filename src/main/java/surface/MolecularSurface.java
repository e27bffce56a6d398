package surface;

import cube.SpectralCube;

import java.util.logging.Logger;

/**
 * The emitting layer of one molecular line: surface detection in every channel of a cube
 * followed by deprojection into the disk frame.
 *
 * <pre>
 * DiskGeometry geometry = DiskGeometry.builder()
 *         .inclination(45).positionAngle(-45.0)
 *         .star(256, 256).systemicVelocity(5.8).distance(101.5)
 *         .build();
 * MolecularSurface surface = MolecularSurface.extract(cube, geometry, new SurfaceDetector(), new Deprojector());
 * double[] r = surface.getDeprojection().getR();
 * </pre>
 */
public class MolecularSurface {

    private static final Logger logger = Logger.getLogger(MolecularSurface.class.getName());

    private final DiskGeometry geometry;
    private final SurfaceDetector.DetectionResult detection;
    private final Deprojector.DeprojectionResult deprojection;

    private MolecularSurface(DiskGeometry geometry, SurfaceDetector.DetectionResult detection,
                             Deprojector.DeprojectionResult deprojection) {
        this.geometry = geometry;
        this.detection = detection;
        this.deprojection = deprojection;
    }

    /**
     * Runs detection and deprojection on a cube. The geometry is checked before any channel
     * is processed.
     *
     * @throws IllegalArgumentException if the geometry is incomplete
     */
    public static MolecularSurface extract(SpectralCube cube, DiskGeometry geometry,
                                           SurfaceDetector detector, Deprojector deprojector) {
        geometry.validateForDeprojection();
        logger.info("Extracting surface: " + geometry);

        SurfaceDetector.DetectionResult detection =
            detector.detect(cube, geometry.positionAngle, geometry.yStar);
        Deprojector.DeprojectionResult deprojection =
            deprojector.deproject(detection, cube, geometry);

        logger.info(String.format("Surface extracted: %d detected points, %d after deprojection",
                detection.totalPoints(), deprojection.size()));
        return new MolecularSurface(geometry, detection, deprojection);
    }

    /** Same as {@link #extract(SpectralCube, DiskGeometry, SurfaceDetector, Deprojector)} with default parameters */
    public static MolecularSurface extract(SpectralCube cube, DiskGeometry geometry) {
        return extract(cube, geometry, new SurfaceDetector(), new Deprojector());
    }

    public DiskGeometry getGeometry() {
        return geometry;
    }

    public SurfaceDetector.DetectionResult getDetection() {
        return detection;
    }

    public Deprojector.DeprojectionResult getDeprojection() {
        return deprojection;
    }
}
