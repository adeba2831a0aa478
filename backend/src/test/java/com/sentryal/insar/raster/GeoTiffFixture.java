package com.sentryal.insar.raster;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.zip.Deflater;

/**
 * Writes small single-band float32 GeoTIFFs for tests.
 */
public final class GeoTiffFixture {

    private static final int TYPE_ASCII = 2;
    private static final int TYPE_SHORT = 3;
    private static final int TYPE_LONG = 4;
    private static final int TYPE_DOUBLE = 12;

    private ByteOrder order = ByteOrder.LITTLE_ENDIAN;
    private boolean deflate;
    private int tileSize;
    private String noData;
    private boolean transformationMatrix;
    private boolean pixelIsPoint;
    private final Map<Integer, Integer> overrides = new TreeMap<>();

    private GeoTiffFixture() {
    }

    public static GeoTiffFixture geoTiff() {
        return new GeoTiffFixture();
    }

    public GeoTiffFixture bigEndian() {
        this.order = ByteOrder.BIG_ENDIAN;
        return this;
    }

    public GeoTiffFixture deflate() {
        this.deflate = true;
        return this;
    }

    public GeoTiffFixture tiled(int tileSize) {
        this.tileSize = tileSize;
        return this;
    }

    public GeoTiffFixture noData(String noData) {
        this.noData = noData;
        return this;
    }

    public GeoTiffFixture transformationMatrix() {
        this.transformationMatrix = true;
        return this;
    }

    public GeoTiffFixture pixelIsPoint() {
        this.pixelIsPoint = true;
        return this;
    }

    /**
     * Replaces the value written for a numeric tag, leaving the pixel data as it is.
     */
    public GeoTiffFixture tag(int tag, int value) {
        overrides.put(tag, value);
        return this;
    }

    public Path write(Path file, int width, int height, GeoTransform transform, float[] values) throws IOException {
        Files.write(file, encode(width, height, transform, values));
        return file;
    }

    public byte[] encode(int width, int height, GeoTransform transform, float[] values) {
        if (values.length != width * height) {
            throw new IllegalArgumentException("Expected " + width * height + " values, got " + values.length);
        }
        List<byte[]> segments = tileSize > 0 ? tiles(width, height, values) : List.of(strip(values));

        Map<Integer, Entry> entries = new TreeMap<>();
        entries.put(GeoTiffReader.TAG_IMAGE_WIDTH, longs(GeoTiffReader.TAG_IMAGE_WIDTH, width));
        entries.put(GeoTiffReader.TAG_IMAGE_LENGTH, longs(GeoTiffReader.TAG_IMAGE_LENGTH, height));
        entries.put(GeoTiffReader.TAG_BITS_PER_SAMPLE, shorts(GeoTiffReader.TAG_BITS_PER_SAMPLE, 32));
        entries.put(GeoTiffReader.TAG_COMPRESSION, shorts(GeoTiffReader.TAG_COMPRESSION, deflate ? 8 : 1));
        entries.put(GeoTiffReader.TAG_SAMPLES_PER_PIXEL, shorts(GeoTiffReader.TAG_SAMPLES_PER_PIXEL, 1));
        entries.put(GeoTiffReader.TAG_SAMPLE_FORMAT, shorts(GeoTiffReader.TAG_SAMPLE_FORMAT, 3));

        int offsetsTag;
        int countsTag;
        if (tileSize > 0) {
            entries.put(GeoTiffReader.TAG_TILE_WIDTH, longs(GeoTiffReader.TAG_TILE_WIDTH, tileSize));
            entries.put(GeoTiffReader.TAG_TILE_LENGTH, longs(GeoTiffReader.TAG_TILE_LENGTH, tileSize));
            offsetsTag = GeoTiffReader.TAG_TILE_OFFSETS;
            countsTag = GeoTiffReader.TAG_TILE_BYTE_COUNTS;
        } else {
            entries.put(GeoTiffReader.TAG_ROWS_PER_STRIP, longs(GeoTiffReader.TAG_ROWS_PER_STRIP, height));
            offsetsTag = GeoTiffReader.TAG_STRIP_OFFSETS;
            countsTag = GeoTiffReader.TAG_STRIP_BYTE_COUNTS;
        }
        int[] counts = new int[segments.size()];
        for (int i = 0; i < counts.length; i++) {
            counts[i] = segments.get(i).length;
        }
        // real offsets are filled in once the layout is known
        entries.put(offsetsTag, longs(offsetsTag, new int[segments.size()]));
        entries.put(countsTag, longs(countsTag, counts));

        if (transformationMatrix) {
            entries.put(GeoTiffReader.TAG_MODEL_TRANSFORMATION, doubles(GeoTiffReader.TAG_MODEL_TRANSFORMATION,
                    transform.pixelWidth(), transform.rowRotation(), 0, transform.originX(),
                    transform.colRotation(), transform.pixelHeight(), 0, transform.originY(),
                    0, 0, 0, 0,
                    0, 0, 0, 1));
        } else {
            entries.put(GeoTiffReader.TAG_MODEL_PIXEL_SCALE, doubles(GeoTiffReader.TAG_MODEL_PIXEL_SCALE,
                    transform.pixelWidth(), -transform.pixelHeight(), 0));
            entries.put(GeoTiffReader.TAG_MODEL_TIEPOINT, doubles(GeoTiffReader.TAG_MODEL_TIEPOINT,
                    0, 0, 0, transform.originX(), transform.originY(), 0));
        }
        if (pixelIsPoint) {
            entries.put(GeoTiffReader.TAG_GEO_KEY_DIRECTORY, shorts(GeoTiffReader.TAG_GEO_KEY_DIRECTORY,
                    1, 1, 0, 1, 1025, 0, 1, 2));
        }
        if (noData != null) {
            byte[] text = (noData + "\0").getBytes(StandardCharsets.US_ASCII);
            entries.put(GeoTiffReader.TAG_GDAL_NODATA, new Entry(GeoTiffReader.TAG_GDAL_NODATA, TYPE_ASCII,
                    text.length, text));
        }

        for (Map.Entry<Integer, Integer> override : overrides.entrySet()) {
            entries.put(override.getKey(), longs(override.getKey(), override.getValue()));
        }

        int ifdSize = 2 + entries.size() * 12 + 4;
        int extraSize = 0;
        for (Entry entry : entries.values()) {
            if (entry.payload.length > 4) {
                extraSize += padded(entry.payload.length);
            }
        }
        int dataStart = 8 + ifdSize + extraSize;
        int[] offsets = new int[segments.size()];
        int end = dataStart;
        for (int i = 0; i < offsets.length; i++) {
            offsets[i] = end;
            end += segments.get(i).length;
        }
        entries.put(offsetsTag, longs(offsetsTag, offsets));

        ByteBuffer out = ByteBuffer.allocate(end).order(order);
        out.put((order == ByteOrder.LITTLE_ENDIAN ? "II" : "MM").getBytes(StandardCharsets.US_ASCII));
        out.putShort((short) 42);
        out.putInt(8);
        out.putShort((short) entries.size());
        int extra = 8 + ifdSize;
        for (Entry entry : entries.values()) {
            out.putShort((short) entry.tag);
            out.putShort((short) entry.type);
            out.putInt(entry.count);
            if (entry.payload.length <= 4) {
                byte[] inline = new byte[4];
                System.arraycopy(entry.payload, 0, inline, 0, entry.payload.length);
                out.put(inline);
            } else {
                out.putInt(extra);
                out.put(extra, entry.payload);
                extra += padded(entry.payload.length);
            }
        }
        out.putInt(0);
        out.position(dataStart);
        for (byte[] segment : segments) {
            out.put(segment);
        }
        return out.array();
    }

    private byte[] strip(float[] values) {
        ByteBuffer raw = ByteBuffer.allocate(values.length * Float.BYTES).order(order);
        for (float v : values) {
            raw.putFloat(v);
        }
        return compress(raw.array());
    }

    private List<byte[]> tiles(int width, int height, float[] values) {
        List<byte[]> tiles = new ArrayList<>();
        for (int tileRow = 0; tileRow < height; tileRow += tileSize) {
            for (int tileCol = 0; tileCol < width; tileCol += tileSize) {
                ByteBuffer raw = ByteBuffer.allocate(tileSize * tileSize * Float.BYTES).order(order);
                for (int r = 0; r < tileSize; r++) {
                    for (int c = 0; c < tileSize; c++) {
                        int row = tileRow + r;
                        int col = tileCol + c;
                        raw.putFloat(row < height && col < width ? values[row * width + col] : 0f);
                    }
                }
                tiles.add(compress(raw.array()));
            }
        }
        return tiles;
    }

    private byte[] compress(byte[] raw) {
        if (!deflate) {
            return raw;
        }
        Deflater deflater = new Deflater();
        deflater.setInput(raw);
        deflater.finish();
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        byte[] chunk = new byte[4096];
        while (!deflater.finished()) {
            out.write(chunk, 0, deflater.deflate(chunk));
        }
        deflater.end();
        return out.toByteArray();
    }

    private Entry shorts(int tag, int... values) {
        ByteBuffer payload = ByteBuffer.allocate(values.length * 2).order(order);
        for (int v : values) {
            payload.putShort((short) v);
        }
        return new Entry(tag, TYPE_SHORT, values.length, payload.array());
    }

    private Entry longs(int tag, int... values) {
        ByteBuffer payload = ByteBuffer.allocate(values.length * 4).order(order);
        for (int v : values) {
            payload.putInt(v);
        }
        return new Entry(tag, TYPE_LONG, values.length, payload.array());
    }

    private Entry doubles(int tag, double... values) {
        ByteBuffer payload = ByteBuffer.allocate(values.length * 8).order(order);
        for (double v : values) {
            payload.putDouble(v);
        }
        return new Entry(tag, TYPE_DOUBLE, values.length, payload.array());
    }

    private static int padded(int length) {
        return length + (length & 1);
    }

    private record Entry(int tag, int type, int count, byte[] payload) {
    }
}
