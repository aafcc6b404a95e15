package com.Unthinkable.TaskAssigner.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
public class StorageService {

    public static final Set<String> AUDIO_EXTENSIONS = Set.of(".wav", ".mp3", ".m4a");

    private final Path baseDir;

    public StorageService(@Value("${app.storage.base-dir:./uploads}") String baseDir) throws IOException {
        this.baseDir = Path.of(baseDir).toAbsolutePath().normalize();
        Files.createDirectories(this.baseDir);
    }

    /**
     * @throws IllegalArgumentException for an empty upload or an unsupported file type
     */
    public Path saveAudio(MultipartFile file) throws IOException {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("Audio file is empty");
        }
        String original = StringUtils.cleanPath(file.getOriginalFilename() == null ? "audio" : file.getOriginalFilename());
        String ext = original.contains(".") ? original.substring(original.lastIndexOf('.')).toLowerCase(Locale.ROOT) : "";
        if (!AUDIO_EXTENSIONS.contains(ext)) {
            throw new IllegalArgumentException("Unsupported audio format '" + ext + "'. Allowed: .wav, .mp3, .m4a");
        }
        String ts = LocalDateTime.now().format(DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss"));
        Path out = baseDir.resolve(ts + "-" + UUID.randomUUID() + ext);
        Files.copy(file.getInputStream(), out, StandardCopyOption.REPLACE_EXISTING);
        return out;
    }

    public void deleteQuietly(Path file) {
        if (file == null) return;
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("Could not delete {}: {}", file, e.toString());
        }
    }
}
