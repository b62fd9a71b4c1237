package superdarn.fov;

import superdarn.fov.model.RadarBeam;
import superdarn.fov.model.RadarGeometry;
import superdarn.fov.model.ResolvedBeam;
import superdarn.fov.model.ResolvedPoint;
import superdarn.fov.model.ScanWindow;
import superdarn.helper.EarthGeometry;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 后向散射视场判定的入口
 *
 * 从波束源按时间读入波束并组装成扫描，对每次扫描计算各点的前后视场传播解并做
 * 扫描视场判定，全部读完后按波束做时间连续性检查。
 *
 * 雷达几何参数在第一条波束时加载一次，整个处理过程使用同一组参数。
 */
public class BackscatterUpdater {

    private static final Logger logger = Logger.getLogger(BackscatterUpdater.class.getName());

    private final FovConfig config;
    private final RadarGeometryProvider geometryProvider;
    private final TdiffProvider tdiffProvider;
    private final EarthGeometry earthGeometry;
    private final List<TemporalContinuityResolver.Restriction> restrictions;

    public BackscatterUpdater(FovConfig config, RadarGeometryProvider geometryProvider) {
        this(config, geometryProvider, null, new EarthGeometry());
    }

    /**
     * @param config 判定配置
     * @param geometryProvider 雷达几何参数来源
     * @param tdiffProvider tdiff来源，可为null（使用几何参数中的tdiff）
     * @param earthGeometry 地球几何
     */
    public BackscatterUpdater(FovConfig config, RadarGeometryProvider geometryProvider,
                              TdiffProvider tdiffProvider, EarthGeometry earthGeometry) {
        this(config, geometryProvider, tdiffProvider, earthGeometry,
            new ArrayList<TemporalContinuityResolver.Restriction>());
    }

    public BackscatterUpdater(FovConfig config, RadarGeometryProvider geometryProvider,
                              TdiffProvider tdiffProvider, EarthGeometry earthGeometry,
                              List<TemporalContinuityResolver.Restriction> restrictions) {
        if (config == null || geometryProvider == null || earthGeometry == null) {
            throw new IllegalArgumentException("configuration, geometry provider and earth geometry are required");
        }
        this.config = config;
        this.geometryProvider = geometryProvider;
        this.tdiffProvider = tdiffProvider;
        this.earthGeometry = earthGeometry;
        this.restrictions = new ArrayList<>(restrictions);
    }

    /**
     * 处理波束源中的全部数据
     *
     * @param source 波束源
     * @return 判定结果
     */
    public BackscatterResult update(BeamSource source) {
        long startTime = System.currentTimeMillis();
        BackscatterResult result = new BackscatterResult();

        RadarBeam first = source.next();
        if (first == null) {
            logger.warning("No beams available in the beam source");
            return result;
        }
        result.getStatistics().incrementBeamsRead();

        RadarGeometry geometry = geometryProvider.geometryFor(first.getStationId(), first.getTime());
        if (geometry == null) {
            logger.severe(String.format("No hardware data available for radar %d at %s",
                first.getStationId(), first.getTime()));
            result.addIssue(first.getTime(), first.getBeamNumber(), "GEOMETRY",
                "no hardware data for station " + first.getStationId());
            return result;
        }
        double earthRadius = earthGeometry.radiusAt(geometry.getGeoLatitude(), geometry.getGeoLongitude());
        logger.fine(String.format("Processing radar %d with %s, earth radius %.3f km",
            first.getStationId(), geometry, earthRadius));

        BeamFitUpdater fitUpdater = new BeamFitUpdater(config);
        ScanFovResolver scanResolver = new ScanFovResolver(config, geometry);
        ScanAssembler assembler = new ScanAssembler();

        assembler.add(first);
        RadarBeam beam;
        while ((beam = source.next()) != null) {
            result.getStatistics().incrementBeamsRead();
            ScanWindow completed = assembler.add(beam);
            if (completed != null) {
                processScan(completed, geometry, earthRadius, fitUpdater, scanResolver, result);
            }
        }
        ScanWindow last = assembler.finish();
        if (last != null) {
            processScan(last, geometry, earthRadius, fitUpdater, scanResolver, result);
        }

        new TemporalContinuityResolver(config, restrictions).resolve(result.getBeams());

        result.getStatistics().setProcessingTimeMs(System.currentTimeMillis() - startTime);
        logger.info("Backscatter update finished: " + result.getStatistics());
        return result;
    }

    private void processScan(ScanWindow scan, RadarGeometry geometry, double earthRadius,
                             BeamFitUpdater fitUpdater, ScanFovResolver scanResolver,
                             BackscatterResult result) {
        if (scan.size() < config.getMinPoints()) {
            logger.info(String.format("Skipping scan at %s with only %d beams", scan.getScanTime(), scan.size()));
            result.getStatistics().incrementSkippedScans();
            return;
        }

        List<ResolvedBeam> resolved = new ArrayList<>();
        for (RadarBeam b : scan.getBeams()) {
            if (!b.hasInterferometerData()) {
                logger.warning(String.format("No interferometer fit data in beam %d at %s",
                    b.getBeamNumber(), b.getTime()));
                result.getStatistics().incrementSkippedBeams();
                continue;
            }
            double tdiff = tdiffFor(b, geometry);
            double tdiffError = tdiffErrorFor(b);
            List<ResolvedPoint> points = fitUpdater.update(b, geometry, earthRadius, tdiff, tdiffError);
            resolved.add(new ResolvedBeam(b, points, tdiff, tdiffError, scan.getScanTime()));
        }

        if (resolved.isEmpty()) {
            logger.severe("Unable to update any beams in the scan at " + scan.getScanTime());
            result.addIssue(scan.getScanTime(), scan.getBeams().get(0).getBeamNumber(), "SCAN",
                "no beams with interferometer data");
            return;
        }

        scanResolver.resolve(resolved);
        result.addScan(resolved);
    }

    /**
     * 依次取波束自带的tdiff、tdiff来源、雷达几何参数中的tdiff
     */
    private double tdiffFor(RadarBeam beam, RadarGeometry geometry) {
        if (beam.getTdiff() != null) {
            return beam.getTdiff();
        }
        if (tdiffProvider != null) {
            double tdiff = tdiffProvider.tdiffFor(beam.getStationId(), beam.getTime(), beam.getTransmitFrequency());
            if (!Double.isNaN(tdiff)) {
                return tdiff;
            }
        }
        return geometry.getTdiff();
    }

    private double tdiffErrorFor(RadarBeam beam) {
        if (beam.getTdiffError() != null) {
            return beam.getTdiffError();
        }
        if (tdiffProvider != null) {
            return tdiffProvider.tdiffErrorFor(beam.getStationId(), beam.getTime(), beam.getTransmitFrequency());
        }
        return Double.NaN;
    }
}
