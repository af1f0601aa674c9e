package de.uos.ikw.izpb.util;

import org.apache.commons.io.FileUtils;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;

public class AuxiliarFunctions {

    /**
     * Creates a folder (and its parents) if it does not exist yet.
     * @param folder Path of the folder.
     */
    public static Path createFolder(Path folder) {
        try {
            FileUtils.forceMkdir(folder.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("IOException while creating folder " + folder, e);
        }
        return folder;
    }

    public static boolean exists(Path path) {
        return path != null && Files.exists(path);
    }

    /**
     * Splits N items into numWorkers consecutive slices whose sizes differ at most by one.
     * @param numWorkers Number of workers.
     * @param N Number of items.
     * @return Array of numWorkers + 1 boundaries; worker i takes items [indexes[i], indexes[i+1]).
     */
    public static Integer[] coalesce(int numWorkers, int N) {
        int futuresPerWorker = (int) Math.floor((double) N / (double) numWorkers);
        int surplus = Math.floorMod(N, numWorkers);

        Integer[] indexes = new Integer[numWorkers + 1];
        indexes[0] = 0;
        for (int i = 1; i <= numWorkers; i++) {
            if (i <= surplus) {
                indexes[i] = indexes[i - 1] + futuresPerWorker + 1;
            } else {
                indexes[i] = indexes[i - 1] + futuresPerWorker;
            }
        }
        return indexes;
    }

    /**
     * NFC-normalizes a string, removes soft hyphens and collapses whitespace runs.
     */
    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFC).replace("\u00AD", "");
        return String.join(" ", normalized.strip().split("\\s+"));
    }

    /**
     * Formats a double for table output; NaN becomes an empty cell.
     */
    public static String formatDouble(double value) {
        return Double.isNaN(value) ? "" : String.valueOf(value);
    }
}
