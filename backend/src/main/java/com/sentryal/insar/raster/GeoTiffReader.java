package com.sentryal.insar.raster;

import com.sentryal.insar.exception.RasterFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.FloatBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Decodes single-band float32 GeoTIFF files into {@link RasterBand}s.
 *
 * <p>Supports classic TIFF in either byte order, strip or tile layout, no compression or
 * Deflate, no predictor. Georeferencing comes from ModelTransformationTag or from
 * ModelPixelScaleTag plus the first ModelTiepointTag; the no-data sentinel from the
 * GDAL_NODATA tag. Anything else is rejected with {@link RasterFormatException}.
 */
@Slf4j
@Component
public class GeoTiffReader {

    static final int TAG_IMAGE_WIDTH = 256;
    static final int TAG_IMAGE_LENGTH = 257;
    static final int TAG_BITS_PER_SAMPLE = 258;
    static final int TAG_COMPRESSION = 259;
    static final int TAG_STRIP_OFFSETS = 273;
    static final int TAG_SAMPLES_PER_PIXEL = 277;
    static final int TAG_ROWS_PER_STRIP = 278;
    static final int TAG_STRIP_BYTE_COUNTS = 279;
    static final int TAG_PREDICTOR = 317;
    static final int TAG_TILE_WIDTH = 322;
    static final int TAG_TILE_LENGTH = 323;
    static final int TAG_TILE_OFFSETS = 324;
    static final int TAG_TILE_BYTE_COUNTS = 325;
    static final int TAG_SAMPLE_FORMAT = 339;
    static final int TAG_MODEL_PIXEL_SCALE = 33550;
    static final int TAG_MODEL_TIEPOINT = 33922;
    static final int TAG_MODEL_TRANSFORMATION = 34264;
    static final int TAG_GEO_KEY_DIRECTORY = 34735;
    static final int TAG_GDAL_NODATA = 42113;

    private static final int COMPRESSION_NONE = 1;
    private static final int COMPRESSION_DEFLATE = 8;
    private static final int COMPRESSION_DEFLATE_LEGACY = 32946;
    private static final int SAMPLE_FORMAT_IEEE_FLOAT = 3;
    private static final int GEO_KEY_RASTER_TYPE = 1025;
    private static final int RASTER_PIXEL_IS_POINT = 2;

    private static final int TYPE_ASCII = 2;

    public RasterBand read(Path file) {
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new RasterFormatException("Raster too large to map: " + file + " (" + size + " bytes)");
            }
            ByteBuffer buffer = channel.map(FileChannel.MapMode.READ_ONLY, 0, size);
            return decode(file.getFileName().toString(), buffer);
        } catch (IOException e) {
            throw new RasterFormatException("Cannot read raster " + file, e);
        }
    }

    RasterBand decode(String sourceName, ByteBuffer buffer) {
        if (buffer.limit() < 8) {
            throw new RasterFormatException(sourceName + ": too short to be a TIFF");
        }
        ByteOrder order = byteOrder(sourceName, buffer);
        buffer.order(order);

        int magic = Short.toUnsignedInt(buffer.getShort(2));
        if (magic == 43) {
            throw new RasterFormatException(sourceName + ": BigTIFF is not supported");
        }
        if (magic != 42) {
            throw new RasterFormatException(sourceName + ": bad TIFF magic " + magic);
        }

        Map<Integer, Field> fields = readDirectory(sourceName, buffer, Integer.toUnsignedLong(buffer.getInt(4)));

        int width = requireInt(sourceName, fields, TAG_IMAGE_WIDTH);
        int height = requireInt(sourceName, fields, TAG_IMAGE_LENGTH);
        checkLayout(sourceName, fields);

        if (width <= 0 || height <= 0) {
            throw new RasterFormatException(sourceName + ": invalid dimensions " + width + "x" + height);
        }
        if ((long) width * height > Integer.MAX_VALUE) {
            throw new RasterFormatException(sourceName + ": " + width + "x" + height + " exceeds addressable size");
        }
        int compression = optionalInt(fields, TAG_COMPRESSION, COMPRESSION_NONE);
        float[] values = new float[width * height];
        if (fields.containsKey(TAG_TILE_WIDTH)) {
            readTiles(sourceName, buffer, fields, compression, width, height, values);
        } else {
            readStrips(sourceName, buffer, fields, compression, width, height, values);
        }

        GeoTransform transform = geoTransform(sourceName, fields);
        Double noData = noData(sourceName, fields);
        log.debug("Decoded {} ({}x{}, noData={}, transform={})", sourceName, width, height, noData, transform);
        return new RasterBand(sourceName, width, height, transform, noData, values);
    }

    private static ByteOrder byteOrder(String sourceName, ByteBuffer buffer) {
        byte first = buffer.get(0);
        byte second = buffer.get(1);
        if (first == 'I' && second == 'I') {
            return ByteOrder.LITTLE_ENDIAN;
        }
        if (first == 'M' && second == 'M') {
            return ByteOrder.BIG_ENDIAN;
        }
        throw new RasterFormatException(sourceName + ": not a TIFF file");
    }

    private static void checkLayout(String sourceName, Map<Integer, Field> fields) {
        int samples = optionalInt(fields, TAG_SAMPLES_PER_PIXEL, 1);
        if (samples != 1) {
            throw new RasterFormatException(sourceName + ": expected 1 sample per pixel, found " + samples);
        }
        int bits = optionalInt(fields, TAG_BITS_PER_SAMPLE, 1);
        int format = optionalInt(fields, TAG_SAMPLE_FORMAT, 1);
        if (bits != 32 || format != SAMPLE_FORMAT_IEEE_FLOAT) {
            throw new RasterFormatException(sourceName + ": expected 32-bit float samples, found "
                    + bits + "-bit format " + format);
        }
        int compression = optionalInt(fields, TAG_COMPRESSION, COMPRESSION_NONE);
        if (compression != COMPRESSION_NONE && compression != COMPRESSION_DEFLATE
                && compression != COMPRESSION_DEFLATE_LEGACY) {
            throw new RasterFormatException(sourceName + ": unsupported compression " + compression);
        }
        int predictor = optionalInt(fields, TAG_PREDICTOR, 1);
        if (predictor != 1) {
            throw new RasterFormatException(sourceName + ": unsupported predictor " + predictor);
        }
    }

    private static void readStrips(String sourceName, ByteBuffer buffer, Map<Integer, Field> fields,
                                   int compression, int width, int height, float[] values) {
        double[] offsets = require(sourceName, fields, TAG_STRIP_OFFSETS).numbers;
        double[] byteCounts = require(sourceName, fields, TAG_STRIP_BYTE_COUNTS).numbers;
        long rowsPerStrip = Math.min(optionalLong(fields, TAG_ROWS_PER_STRIP, height), height);
        if (offsets.length != byteCounts.length || rowsPerStrip <= 0) {
            throw new RasterFormatException(sourceName + ": inconsistent strip layout");
        }
        if (offsets.length * rowsPerStrip < height) {
            throw new RasterFormatException(sourceName + ": " + offsets.length + " strips of " + rowsPerStrip
                    + " rows do not cover " + height + " rows");
        }

        for (int strip = 0; strip < offsets.length; strip++) {
            long firstRow = strip * rowsPerStrip;
            if (firstRow >= height) {
                break;
            }
            int rows = (int) Math.min(rowsPerStrip, height - firstRow);
            int expected = rows * width * Float.BYTES;
            byte[] data = segment(sourceName, buffer, (long) offsets[strip], (long) byteCounts[strip],
                    compression, expected);
            FloatBuffer floats = ByteBuffer.wrap(data).order(buffer.order()).asFloatBuffer();
            floats.get(values, (int) firstRow * width, rows * width);
        }
    }

    private static void readTiles(String sourceName, ByteBuffer buffer, Map<Integer, Field> fields,
                                  int compression, int width, int height, float[] values) {
        int tileWidth = requireInt(sourceName, fields, TAG_TILE_WIDTH);
        int tileLength = requireInt(sourceName, fields, TAG_TILE_LENGTH);
        if (tileWidth <= 0 || tileLength <= 0) {
            throw new RasterFormatException(sourceName + ": invalid tile size " + tileWidth + "x" + tileLength);
        }
        double[] offsets = require(sourceName, fields, TAG_TILE_OFFSETS).numbers;
        double[] byteCounts = require(sourceName, fields, TAG_TILE_BYTE_COUNTS).numbers;
        int across = (width + tileWidth - 1) / tileWidth;
        int down = (height + tileLength - 1) / tileLength;
        if (offsets.length < across * down || byteCounts.length < across * down) {
            throw new RasterFormatException(sourceName + ": expected " + (across * down) + " tiles, found "
                    + offsets.length);
        }

        int expected = tileWidth * tileLength * Float.BYTES;
        for (int tile = 0; tile < across * down; tile++) {
            int tileCol = (tile % across) * tileWidth;
            int tileRow = (tile / across) * tileLength;
            byte[] data = segment(sourceName, buffer, (long) offsets[tile], (long) byteCounts[tile],
                    compression, expected);
            FloatBuffer floats = ByteBuffer.wrap(data).order(buffer.order()).asFloatBuffer();
            int cols = Math.min(tileWidth, width - tileCol);
            for (int r = 0; r < tileLength && tileRow + r < height; r++) {
                floats.position(r * tileWidth);
                floats.get(values, (tileRow + r) * width + tileCol, cols);
            }
        }
    }

    private static byte[] segment(String sourceName, ByteBuffer buffer, long offset, long byteCount,
                                  int compression, int expected) {
        int start = checkedRange(sourceName, buffer, offset, byteCount);
        byte[] raw = new byte[(int) byteCount];
        buffer.get(start, raw);
        if (compression == COMPRESSION_NONE) {
            if (raw.length < expected) {
                throw new RasterFormatException(sourceName + ": segment holds " + raw.length
                        + " bytes, expected " + expected);
            }
            return raw;
        }
        return inflate(sourceName, raw, expected);
    }

    private static byte[] inflate(String sourceName, byte[] raw, int expected) {
        Inflater inflater = new Inflater();
        try {
            inflater.setInput(raw);
            byte[] out = new byte[expected];
            int produced = 0;
            while (produced < expected && !inflater.finished()) {
                int n = inflater.inflate(out, produced, expected - produced);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                produced += n;
            }
            if (produced < expected) {
                throw new RasterFormatException(sourceName + ": deflate segment produced " + produced
                        + " bytes, expected " + expected);
            }
            return out;
        } catch (DataFormatException e) {
            throw new RasterFormatException(sourceName + ": corrupt deflate segment", e);
        } finally {
            inflater.end();
        }
    }

    private static GeoTransform geoTransform(String sourceName, Map<Integer, Field> fields) {
        GeoTransform transform;
        Field matrix = fields.get(TAG_MODEL_TRANSFORMATION);
        Field scale = fields.get(TAG_MODEL_PIXEL_SCALE);
        Field tiepoint = fields.get(TAG_MODEL_TIEPOINT);
        if (matrix != null && matrix.numbers.length >= 16) {
            double[] m = matrix.numbers;
            transform = new GeoTransform(m[3], m[0], m[1], m[7], m[4], m[5]);
        } else if (scale != null && tiepoint != null && scale.numbers.length >= 2 && tiepoint.numbers.length >= 6) {
            double[] s = scale.numbers;
            double[] t = tiepoint.numbers;
            transform = new GeoTransform(t[3] - t[0] * s[0], s[0], 0.0, t[4] + t[1] * s[1], 0.0, -s[1]);
        } else {
            throw new RasterFormatException(sourceName + ": no georeferencing tags");
        }

        if (rasterType(fields) == RASTER_PIXEL_IS_POINT) {
            transform = new GeoTransform(
                    transform.originX() - 0.5 * (transform.pixelWidth() + transform.rowRotation()),
                    transform.pixelWidth(), transform.rowRotation(),
                    transform.originY() - 0.5 * (transform.colRotation() + transform.pixelHeight()),
                    transform.colRotation(), transform.pixelHeight());
        }
        if (!transform.isInvertible()) {
            throw new RasterFormatException(sourceName + ": degenerate geotransform " + transform);
        }
        return transform;
    }

    private static int rasterType(Map<Integer, Field> fields) {
        Field directory = fields.get(TAG_GEO_KEY_DIRECTORY);
        if (directory == null || directory.numbers.length < 4) {
            return 0;
        }
        double[] keys = directory.numbers;
        int count = (int) keys[3];
        for (int i = 0; i < count && 4 + i * 4 + 3 < keys.length; i++) {
            int base = 4 + i * 4;
            if ((int) keys[base] == GEO_KEY_RASTER_TYPE && (int) keys[base + 1] == 0) {
                return (int) keys[base + 3];
            }
        }
        return 0;
    }

    private static Double noData(String sourceName, Map<Integer, Field> fields) {
        Field field = fields.get(TAG_GDAL_NODATA);
        if (field == null || field.text == null || field.text.isBlank()) {
            return null;
        }
        String text = field.text.trim();
        if (text.toLowerCase(Locale.ROOT).equals("nan")) {
            return Double.NaN;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            log.warn("{}: ignoring unparsable GDAL_NODATA value '{}'", sourceName, text);
            return null;
        }
    }

    private static Map<Integer, Field> readDirectory(String sourceName, ByteBuffer buffer, long offset) {
        int start = checkedRange(sourceName, buffer, offset, 2);
        int count = Short.toUnsignedInt(buffer.getShort(start));
        checkedRange(sourceName, buffer, offset + 2, (long) count * 12);

        Map<Integer, Field> fields = new HashMap<>();
        for (int i = 0; i < count; i++) {
            int entry = start + 2 + i * 12;
            int tag = Short.toUnsignedInt(buffer.getShort(entry));
            int type = Short.toUnsignedInt(buffer.getShort(entry + 2));
            long n = Integer.toUnsignedLong(buffer.getInt(entry + 4));
            int size = typeSize(type);
            if (size == 0) {
                continue;
            }
            if (n > Integer.MAX_VALUE / 8) {
                throw new RasterFormatException(sourceName + ": tag " + tag + " declares " + n + " values");
            }
            long length = n * size;
            int valuePos = length <= 4
                    ? entry + 8
                    : checkedRange(sourceName, buffer, Integer.toUnsignedLong(buffer.getInt(entry + 8)), length);
            if (type == TYPE_ASCII) {
                byte[] bytes = new byte[(int) n];
                buffer.get(valuePos, bytes);
                fields.put(tag, new Field(null, new String(bytes, StandardCharsets.US_ASCII).replace("\0", "")));
            } else {
                fields.put(tag, new Field(readNumbers(buffer, type, valuePos, (int) n), null));
            }
        }
        return fields;
    }

    private static double[] readNumbers(ByteBuffer buffer, int type, int pos, int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            switch (type) {
                case 1:
                case 7:
                    out[i] = Byte.toUnsignedInt(buffer.get(pos + i));
                    break;
                case 6:
                    out[i] = buffer.get(pos + i);
                    break;
                case 3:
                    out[i] = Short.toUnsignedInt(buffer.getShort(pos + i * 2));
                    break;
                case 8:
                    out[i] = buffer.getShort(pos + i * 2);
                    break;
                case 4:
                case 13:
                    out[i] = Integer.toUnsignedLong(buffer.getInt(pos + i * 4));
                    break;
                case 9:
                    out[i] = buffer.getInt(pos + i * 4);
                    break;
                case 5:
                    out[i] = rational(Integer.toUnsignedLong(buffer.getInt(pos + i * 8)),
                            Integer.toUnsignedLong(buffer.getInt(pos + i * 8 + 4)));
                    break;
                case 10:
                    out[i] = rational(buffer.getInt(pos + i * 8), buffer.getInt(pos + i * 8 + 4));
                    break;
                case 11:
                    out[i] = buffer.getFloat(pos + i * 4);
                    break;
                case 12:
                    out[i] = buffer.getDouble(pos + i * 8);
                    break;
                default:
                    throw new IllegalArgumentException("Unhandled TIFF type " + type);
            }
        }
        return out;
    }

    private static double rational(long numerator, long denominator) {
        return denominator == 0 ? Double.NaN : (double) numerator / denominator;
    }

    private static int typeSize(int type) {
        switch (type) {
            case 1:
            case 2:
            case 6:
            case 7:
                return 1;
            case 3:
            case 8:
                return 2;
            case 4:
            case 9:
            case 11:
            case 13:
                return 4;
            case 5:
            case 10:
            case 12:
                return 8;
            default:
                return 0;
        }
    }

    private static int checkedRange(String sourceName, ByteBuffer buffer, long offset, long length) {
        if (offset < 0 || length < 0 || offset + length > buffer.limit()) {
            throw new RasterFormatException(sourceName + ": offset " + offset + " + " + length
                    + " runs past end of file (" + buffer.limit() + " bytes)");
        }
        return (int) offset;
    }

    private static Field require(String sourceName, Map<Integer, Field> fields, int tag) {
        Field field = fields.get(tag);
        if (field == null || field.numbers == null || field.numbers.length == 0) {
            throw new RasterFormatException(sourceName + ": missing required tag " + tag);
        }
        return field;
    }

    private static int requireInt(String sourceName, Map<Integer, Field> fields, int tag) {
        return (int) require(sourceName, fields, tag).numbers[0];
    }

    private static int optionalInt(Map<Integer, Field> fields, int tag, int fallback) {
        return (int) optionalLong(fields, tag, fallback);
    }

    private static long optionalLong(Map<Integer, Field> fields, int tag, long fallback) {
        Field field = fields.get(tag);
        if (field == null || field.numbers == null || field.numbers.length == 0) {
            return fallback;
        }
        return (long) field.numbers[0];
    }

    private record Field(double[] numbers, String text) {
    }
}
