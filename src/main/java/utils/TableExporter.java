package utils;

import com.alibaba.fastjson2.JSON;
import ef.ValueTableSnapshot;

import java.io.*;

/**
 * Appends value table snapshots to a file, one JSON object per line.
 */
public class TableExporter implements AutoCloseable {
    private final File outputFile;
    private final BufferedWriter bufferedWriter;

    public TableExporter(String outputPath) {
        this.outputFile = initOutputFile(outputPath);
        this.bufferedWriter = initBufferedWriter(this.outputFile);
    }

    private File initOutputFile(String outputPath) {
        File file = new File(outputPath);
        File parentDir = file.getAbsoluteFile().getParentFile();

        if (parentDir != null && !parentDir.exists()) {
            if (!parentDir.mkdirs()) {
                Log.error("Failed to create directory: " + parentDir.getAbsolutePath());
                throw new UncheckedIOException(new IOException("Directory creation failed: " + parentDir));
            }
        }
        return file;
    }

    private BufferedWriter initBufferedWriter(File file) {
        try {
            return new BufferedWriter(new FileWriter(file, true));
        } catch (IOException e) {
            Log.error("Failed to initialize BufferedWriter for file: " + file.getAbsolutePath() + e);
            throw new UncheckedIOException("BufferedWriter initialization failed", e);
        }
    }

    public synchronized void writeSnapshot(ValueTableSnapshot snapshot) {
        try {
            bufferedWriter.write(JSON.toJSONString(snapshot));
            bufferedWriter.newLine();
            bufferedWriter.flush();
        } catch (IOException e) {
            Log.error("Failed to write value table to file: " + this.outputFile.getAbsolutePath() + e);
            throw new UncheckedIOException(e);
        }
    }

    public File getOutputFile() {
        return outputFile;
    }

    @Override
    public void close() {
        try {
            bufferedWriter.close();
        } catch (IOException e) {
            Log.error("Failed to close BufferedWriter: " + e.getMessage());
        }
    }
}
