/*
 * MRE Contrast Statistics
 * Copyright (c) 2025 XNATWorks.
 * All rights reserved.
 *
 * This software is distributed under the terms described in the LICENSE file.
 */
package io.xnatworks.mrestats.dicom;

import org.dcm4che3.data.Attributes;
import org.dcm4che3.data.Tag;
import org.dcm4che3.io.DicomInputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.file.Path;

/**
 * Reads SliceLocation and native pixel data from single-frame DICOM slices.
 *
 * Pixel values are returned as stored: modality rescale is not applied, unit scaling of
 * contrasts is configured separately. Encapsulated (compressed) pixel data is not supported.
 */
public class DicomSliceReader {
    private static final Logger log = LoggerFactory.getLogger(DicomSliceReader.class);

    /**
     * Read the SliceLocation without loading pixel data.
     *
     * @return the location in mm, or null if the tag is absent or empty
     * @throws IOException if the file is not readable DICOM
     */
    public Double readSliceLocation(Path file) throws IOException {
        Attributes attrs = readAttributes(file, Tag.PixelData);
        return sliceLocationOf(attrs);
    }

    /**
     * Read the first frame of the image.
     *
     * @throws IOException if the file is not readable DICOM or its pixel data cannot be decoded
     */
    public DicomImage readImage(Path file) throws IOException {
        Attributes attrs = readAttributes(file, -1);

        int rows = attrs.getInt(Tag.Rows, 0);
        int columns = attrs.getInt(Tag.Columns, 0);
        if (rows <= 0 || columns <= 0) {
            throw new IOException("Missing image dimensions in " + file);
        }
        int samplesPerPixel = attrs.getInt(Tag.SamplesPerPixel, 1);
        if (samplesPerPixel != 1) {
            throw new IOException("Expected a single-sample image, got SamplesPerPixel=" + samplesPerPixel + " in " + file);
        }
        int bitsAllocated = attrs.getInt(Tag.BitsAllocated, 16);
        int bitsStored = attrs.getInt(Tag.BitsStored, bitsAllocated);
        boolean signed = attrs.getInt(Tag.PixelRepresentation, 0) == 1;

        Object value = attrs.getValue(Tag.PixelData);
        if (!(value instanceof byte[])) {
            throw new IOException("No native pixel data in " + file + " (missing or encapsulated)");
        }
        byte[] data = (byte[]) value;
        ByteOrder order = attrs.bigEndian() ? ByteOrder.BIG_ENDIAN : ByteOrder.LITTLE_ENDIAN;

        double[] pixels = decode(data, order, rows * columns, bitsAllocated, bitsStored, signed, file);
        return new DicomImage(rows, columns, pixels, sliceLocationOf(attrs));
    }

    static double[] decode(byte[] data, ByteOrder order, int count, int bitsAllocated, int bitsStored,
                           boolean signed, Path file) throws IOException {
        if (bitsAllocated != 8 && bitsAllocated != 16 && bitsAllocated != 32) {
            throw new IOException("Unsupported BitsAllocated=" + bitsAllocated + " in " + file);
        }
        if (bitsStored <= 0 || bitsStored > bitsAllocated) {
            bitsStored = bitsAllocated;
        }
        int bytesPerPixel = bitsAllocated / 8;
        if (data.length < (long) count * bytesPerPixel) {
            throw new IOException("Pixel data of " + file + " has " + data.length + " bytes, expected "
                    + ((long) count * bytesPerPixel));
        }

        ByteBuffer buffer = ByteBuffer.wrap(data).order(order);
        long storedMask = (1L << bitsStored) - 1;
        long signBit = 1L << (bitsStored - 1);
        double[] pixels = new double[count];
        for (int i = 0; i < count; i++) {
            long raw;
            switch (bitsAllocated) {
                case 8:
                    raw = buffer.get(i) & 0xFFL;
                    break;
                case 16:
                    raw = buffer.getShort(i * 2) & 0xFFFFL;
                    break;
                default:
                    raw = buffer.getInt(i * 4) & 0xFFFFFFFFL;
                    break;
            }
            long stored = raw & storedMask;
            if (signed && (stored & signBit) != 0) {
                stored -= (1L << bitsStored);
            }
            pixels[i] = stored;
        }
        return pixels;
    }

    static Double sliceLocationOf(Attributes attrs) {
        if (!attrs.containsValue(Tag.SliceLocation)) {
            return null;
        }
        double location = attrs.getDouble(Tag.SliceLocation, Double.NaN);
        return Double.isNaN(location) ? null : location;
    }

    private Attributes readAttributes(Path file, int stopTag) throws IOException {
        try (DicomInputStream dis = new DicomInputStream(file.toFile())) {
            return dis.readDataset(-1, stopTag);
        } catch (IOException e) {
            log.debug("Not readable as DICOM: {} ({})", file, e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            // dcm4che reports some malformed streams with unchecked exceptions
            throw new IOException("Malformed DICOM file " + file + ": " + e.getMessage(), e);
        }
    }
}
