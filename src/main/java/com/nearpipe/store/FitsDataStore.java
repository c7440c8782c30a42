package com.nearpipe.store;

import static com.nearpipe.NearPipeline.LOGGER;

import com.nearpipe.service.FitsHeaders;
import ij.ImageStack;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.BinaryTable;
import nom.tam.fits.BinaryTableHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.FitsFactory;
import nom.tam.fits.Header;
import nom.tam.fits.NullDataHDU;
import org.apache.logging.log4j.Marker;
import org.apache.logging.log4j.MarkerManager;

/**
 * Persiste cada stream como {@code <raiz>/<nombre>.fits}: HDU primario con el cubo
 * (frames x y x x) y los atributos estaticos como tarjetas {@code HIERARCH ATTR <NOMBRE>};
 * una tabla binaria de una columna por atributo no estatico (EXTNAME = nombre).
 * Los streams de texto van a {@code <raiz>/<nombre>.txt}.
 */
public class FitsDataStore implements DataStore {
    private static final Marker IT = MarkerManager.getMarker(FitsDataStore.class.getSimpleName());

    static final String ATTR_PREFIX = "ATTR ";

    private final Path root;
    private final Map<String, FitsStream> streams = new HashMap<>();

    public FitsDataStore(Path root) throws IOException {
        this.root = root;
        Files.createDirectories(root);
    }

    public Path fileFor(String name) { return root.resolve(name + ".fits"); }

    @Override
    public FrameStream open(String name) {
        return streams.computeIfAbsent(name, FitsStream::new);
    }

    @Override
    public void putText(String name, List<String> lines) throws IOException {
        Path p = root.resolve(name + ".txt");
        if (p.getParent() != null) Files.createDirectories(p.getParent());
        Files.write(p, lines, StandardCharsets.UTF_8);
    }

    @Override
    public List<String> getText(String name) throws IOException {
        Path p = root.resolve(name + ".txt");
        if (!Files.exists(p)) return null;
        return Files.readAllLines(p, StandardCharsets.UTF_8);
    }

    class FitsStream extends FrameStream {

        FitsStream(String name) { super(name); }

        private File file() { return fileFor(name()).toFile(); }

        @Override
        protected void persist() throws IOException {
            FitsFactory.setUseHierarch(true);
            Path target = fileFor(name());
            if (target.getParent() != null) Files.createDirectories(target.getParent());
            Files.deleteIfExists(target);

            try (Fits fits = new Fits()) {
                BasicHDU<?> primary = frameCount() > 0 ? Fits.makeHDU(toCube(frames())) : new NullDataHDU();
                Header h = primary.getHeader();
                for (Map.Entry<String, Object> e : staticAttributes().entrySet()) {
                    addCard(h, FitsHeaders.hierarchKey(ATTR_PREFIX + e.getKey()), e.getValue());
                }
                for (String line : history()) h.insertHistory(line);
                fits.addHDU(primary);

                for (Map.Entry<String, List<Object>> e : nonStaticAttributes().entrySet()) {
                    BinaryTable table = new BinaryTable();
                    table.addColumn(toColumn(e.getValue()));
                    BasicHDU<?> hdu = Fits.makeHDU(table);
                    hdu.getHeader().addValue("EXTNAME", e.getKey(), "non-static attribute");
                    fits.addHDU(hdu);
                }
                fits.write(file());
            } catch (FitsException e) {
                throw new IOException("Error writing stream " + name() + " to " + target, e);
            }
            LOGGER.debug(IT, "Stream '{}' guardado ({} frames)", name(), frameCount());
        }

        @Override
        protected void deletePersisted() throws IOException {
            Files.deleteIfExists(fileFor(name()));
        }

        @Override
        protected void loadPersisted() throws IOException {
            if (!file().exists()) return;
            FitsFactory.setUseHierarch(true);
            try (Fits fits = new Fits(file())) {
                BasicHDU<?>[] hdus = fits.read();
                if (hdus == null || hdus.length == 0) return;

                ImageStack stack = null;
                Object kernel = hdus[0].getKernel();
                if (kernel instanceof float[][][]) stack = fromCube((float[][][]) kernel);

                Map<String, Object> statics = new LinkedHashMap<>();
                for (Map.Entry<String, Object> e : FitsHeaders.toMap(hdus[0].getHeader()).entrySet()) {
                    if (e.getKey().startsWith(ATTR_PREFIX)) statics.put(e.getKey().substring(ATTR_PREFIX.length()), e.getValue());
                }

                Map<String, List<Object>> nonStatics = new LinkedHashMap<>();
                for (int i = 1; i < hdus.length; i++) {
                    if (!(hdus[i] instanceof BinaryTableHDU)) continue;
                    BinaryTableHDU t = (BinaryTableHDU) hdus[i];
                    String attr = t.getHeader().getStringValue("EXTNAME");
                    if (attr == null) continue;
                    nonStatics.put(attr.trim(), fromColumn(t.getColumn(0)));
                }
                restore(stack, statics, nonStatics, FitsHeaders.history(hdus[0].getHeader()));
                LOGGER.info(IT, "Stream '{}' recuperado de {} ({} frames)", name(), file(), frameCount());
            } catch (FitsException e) {
                throw new IOException("Error reading stream " + name() + " from " + file(), e);
            }
        }
    }

    // --- CONVERSIONES ---

    private static void addCard(Header h, String key, Object v) throws FitsException {
        if (v instanceof Boolean) h.addValue(key, (Boolean) v, null);
        else if (v instanceof Long || v instanceof Integer) h.addValue(key, ((Number) v).longValue(), null);
        else if (v instanceof Number) h.addValue(key, ((Number) v).doubleValue(), null);
        else h.addValue(key, String.valueOf(v), null);
    }

    static float[][][] toCube(ImageStack stack) {
        int w = stack.getWidth(), h = stack.getHeight();
        float[][][] cube = new float[stack.getSize()][h][w];
        for (int n = 0; n < stack.getSize(); n++) {
            float[] px = (float[]) stack.getPixels(n + 1);
            for (int y = 0; y < h; y++) System.arraycopy(px, y * w, cube[n][y], 0, w);
        }
        return cube;
    }

    static ImageStack fromCube(float[][][] cube) {
        if (cube.length == 0 || cube[0].length == 0) return null;
        int h = cube[0].length, w = cube[0][0].length;
        ImageStack stack = new ImageStack(w, h);
        for (float[][] plane : cube) {
            float[] px = new float[w * h];
            for (int y = 0; y < h; y++) System.arraycopy(plane[y], 0, px, y * w, w);
            stack.addSlice(null, px);
        }
        return stack;
    }

    /**
     * Columna FITS para una lista de valores. Los null (frames sin valor) se guardan como
     * NaN en columnas numericas y como texto vacio en columnas de texto.
     */
    static Object toColumn(List<Object> values) {
        boolean allLong = true, allNumber = true, allBoolean = true, anyNull = false, anyValue = false;
        for (Object v : values) {
            if (v == null) {
                anyNull = true;
                continue;
            }
            anyValue = true;
            allLong &= (v instanceof Long || v instanceof Integer);
            allNumber &= v instanceof Number;
            allBoolean &= v instanceof Boolean;
        }
        int n = values.size();
        if (allLong && !anyNull) {
            long[] col = new long[n];
            for (int i = 0; i < n; i++) col[i] = ((Number) values.get(i)).longValue();
            return col;
        }
        if (allNumber || !anyValue) {
            double[] col = new double[n];
            for (int i = 0; i < n; i++) {
                Object v = values.get(i);
                col[i] = v == null ? Double.NaN : ((Number) v).doubleValue();
            }
            return col;
        }
        if (allBoolean && !anyNull) {
            boolean[] col = new boolean[n];
            for (int i = 0; i < n; i++) col[i] = (Boolean) values.get(i);
            return col;
        }
        String[] col = new String[n];
        for (int i = 0; i < n; i++) {
            Object v = values.get(i);
            if (v instanceof Boolean) col[i] = ((Boolean) v) ? "T" : "F";
            else col[i] = v == null ? "" : String.valueOf(v);
        }
        return col;
    }

    // NaN y texto vacio vuelven como null
    static List<Object> fromColumn(Object column) {
        List<Object> out = new ArrayList<>();
        if (column instanceof long[]) for (long v : (long[]) column) out.add(v);
        else if (column instanceof double[]) for (double v : (double[]) column) out.add(Double.isNaN(v) ? null : v);
        else if (column instanceof boolean[]) for (boolean v : (boolean[]) column) out.add(v);
        else if (column instanceof String[]) {
            for (String v : (String[]) column) {
                String t = v == null ? "" : v.trim();
                out.add(t.isEmpty() ? null : t);
            }
        }
        return out;
    }
}
