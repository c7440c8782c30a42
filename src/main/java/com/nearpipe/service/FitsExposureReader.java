package com.nearpipe.service;

import com.nearpipe.model.RawExposure;
import com.nearpipe.model.RawExposure.RawFrame;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;

/**
 * Lee un fichero VISIR burst: HDU 0 solo header, HDU 1..N un frame con su header pequeno,
 * y el ultimo HDU el promedio de todos (se descarta).
 * nom.tam.fits ya entrega los datos en el orden de bytes nativo.
 */
public class FitsExposureReader implements ExposureReader {

    @Override
    public RawExposure read(Path file) throws IOException {
        FitsFactory.setUseHierarch(true);
        try (Fits fits = new Fits(file.toFile())) {
            BasicHDU<?>[] hdus = fits.read();
            if (hdus == null || hdus.length < 3) {
                throw new IOException("File " + file + " should hold a header, at least one frame and the averaged frame");
            }
            Map<String, Object> primary = FitsHeaders.toMap(hdus[0].getHeader());

            List<RawFrame> frames = new ArrayList<>(hdus.length - 2);
            for (int i = 1; i < hdus.length - 1; i++) {
                Object kernel = hdus[i].getKernel();
                if (kernel == null) throw new IOException("Frame " + (i - 1) + " of " + file + " has no image data");
                frames.add(new RawFrame(FitsHeaders.toMap(hdus[i].getHeader()), kernel));
            }
            return new RawExposure(file.getFileName().toString(), primary, frames);
        } catch (FitsException e) {
            throw new IOException("Error reading fits file " + file, e);
        }
    }
}
