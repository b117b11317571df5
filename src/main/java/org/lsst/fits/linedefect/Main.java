package org.lsst.fits.linedefect;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Properties;
import org.lsst.fits.linedefect.batch.BatchInspector;
import org.lsst.fits.linedefect.batch.BatchItemResult;

/**
 * Command line driver: inspects the given FITS files and prints a summary.
 * <pre>
 * Main [--config settings.properties] file.fits...
 * </pre>
 *
 * @author tonyj
 */
public class Main {

    public static void main(String[] args) throws IOException {
        InspectionConfig config = InspectionConfig.defaults();
        List<Path> files = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) && i + 1 < args.length) {
                config = readConfig(Paths.get(args[++i]));
            } else {
                files.add(Paths.get(args[i]));
            }
        }
        if (files.isEmpty()) {
            System.err.println("Usage: Main [--config settings.properties] file.fits...");
            System.exit(2);
        }
        int failed = 0;
        try (BatchInspector inspector = new BatchInspector()) {
            for (BatchItemResult item : inspector.inspect(files, config)) {
                if (item.getStatus() == BatchItemResult.Status.ERROR) {
                    System.out.printf("%s\tERROR\t%s%n", item.getPath(), item.getError());
                    failed++;
                    continue;
                }
                List<Defect> defects = item.getResult().getDefects();
                System.out.printf("%s\t%s\t%d\t%dms%n", item.getPath(), item.getStatus(), defects.size(), item.getElapsedMillis());
                for (Defect d : defects) {
                    System.out.printf("\t%s\t%d\t%s\tch%d\t%.2f%n", d.getOrientation(), d.getIndex(), d.getMode(), d.getChannel(), d.getDiff());
                }
                if (item.getStatus() != BatchItemResult.Status.PASS) {
                    failed++;
                }
            }
        }
        System.exit(failed == 0 ? 0 : 1);
    }

    static InspectionConfig readConfig(Path path) throws IOException {
        Properties props = new Properties();
        try (InputStream in = Files.newInputStream(path)) {
            props.load(in);
        }
        return InspectionConfig.fromProperties(props);
    }
}
