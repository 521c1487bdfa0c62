package com.relayjobs;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;

public class TailBuffer {
    // bytes read from the end of the log per requested line
    private static final long BYTES_PER_LINE = 1024L;
    private static final long MAX_WINDOW = 4L * 1024 * 1024;

    private final int capacity;
    private final ArrayDeque<String> lines;

    public TailBuffer(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
        this.lines = new ArrayDeque<>(capacity);
    }

    public synchronized void add(String line) {
        if (lines.size() == capacity) lines.removeFirst();
        lines.addLast(line);
    }

    public synchronized void addAll(List<String> more) {
        for (String l : more) add(l);
    }

    public synchronized List<String> snapshot() {
        return new ArrayList<>(lines);
    }

    public static TailBuffer readFrom(Path file, int capacity) throws IOException {
        TailBuffer buf = new TailBuffer(capacity);
        long size;
        try {
            size = Files.size(file);
        } catch (NoSuchFileException e) {
            return buf;
        }
        if (size == 0) return buf;
        long window = Math.min(size, Math.min(MAX_WINDOW, capacity * BYTES_PER_LINE));
        byte[] bytes = new byte[(int) window];
        try (RandomAccessFile raf = new RandomAccessFile(file.toFile(), "r")) {
            raf.seek(size - window);
            raf.readFully(bytes);
        }
        String text = new String(bytes, StandardCharsets.UTF_8);
        String[] parts = text.split("\r?\n", -1);
        int start = window < size ? 1 : 0; // first line may be cut
        int end = parts.length;
        if (end > start && parts[end - 1].isEmpty()) end--;
        for (int i = start; i < end; i++) buf.add(parts[i]);
        return buf;
    }
}
