package github.sarthakdev143.chat_renderer.integration.video;

import github.sarthakdev143.chat_renderer.engine.pipeline.FrameRun;
import github.sarthakdev143.chat_renderer.engine.pipeline.RenderProgressListener;
import github.sarthakdev143.chat_renderer.service.VideoAssembler;
import github.sarthakdev143.chat_renderer.service.VideoEncodeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.BufferedOutputStream;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.TimeUnit;

@Component
public class FfmpegVideoAssembler implements VideoAssembler {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegVideoAssembler.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final int MAX_CAPTURED_OUTPUT_CHARS = 16_384;
    private static final long FINISH_TIMEOUT_MINUTES = 10;
    private static final double STARTED_PROGRESS = 0.01;

    @Override
    public void assemble(
            VideoEncodeSettings settings,
            Iterator<FrameRun> frames,
            Path audioTrack,
            Path outputVideoPath,
            RenderProgressListener progress) throws IOException, InterruptedException {
        List<String> command = buildEncodeCommand(settings, audioTrack, outputVideoPath);
        logger.info("Running FFmpeg encode: {}", String.join(" ", command));

        Process process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
        OutputCollector output = new OutputCollector(process);
        Thread drain = new Thread(output, "ffmpeg-output");
        drain.setDaemon(true);
        drain.start();

        progress.onProgress(STARTED_PROGRESS);
        boolean completed = false;
        try {
            int written = 0;
            try (OutputStream stdin = new BufferedOutputStream(process.getOutputStream(), 1 << 20)) {
                while (frames.hasNext()) {
                    FrameRun run = frames.next();
                    byte[] pixels = toBgr24(run.image(), settings);
                    for (int copy = 0; copy < run.repeat(); copy++) {
                        stdin.write(pixels);
                    }
                    written += run.repeat();
                    progress.onProgress(frameProgress(written, settings.totalFrames()));
                }
            } catch (IOException pipeError) {
                waitQuietly(process);
                throw new IOException("FFmpeg stopped accepting frames. Output: " + output.text(), pipeError);
            }

            boolean finished = process.waitFor(FINISH_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            if (!finished) {
                throw new IOException("FFmpeg timed out while finishing the encode.");
            }
            drain.join(TimeUnit.SECONDS.toMillis(2));
            if (process.exitValue() != 0) {
                throw new IOException(
                        "FFmpeg encode failed with exit code " + process.exitValue() + ". Output: " + output.text());
            }
            completed = true;
        } finally {
            if (!completed) {
                process.destroyForcibly();
            }
        }

        progress.onProgress(1.0);
        logger.info("FFmpeg encode finished: {}", outputVideoPath);
    }

    List<String> buildEncodeCommand(VideoEncodeSettings settings, Path audioTrack, Path outputVideoPath) {
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        command.add("-f");
        command.add("rawvideo");
        command.add("-pixel_format");
        command.add("bgr24");
        command.add("-video_size");
        command.add(settings.width() + "x" + settings.height());
        command.add("-framerate");
        command.add(String.valueOf(settings.fps()));
        command.add("-i");
        command.add("-");
        if (audioTrack != null) {
            command.add("-i");
            command.add(audioTrack.toString());
            command.add("-map");
            command.add("0:v");
            command.add("-map");
            command.add("1:a");
        }
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("slow");
        command.add("-crf");
        command.add("18");
        command.add("-maxrate");
        command.add("12M");
        command.add("-bufsize");
        command.add("24M");
        command.add("-pix_fmt");
        command.add("yuv420p");
        if (audioTrack != null) {
            command.add("-c:a");
            command.add("aac");
            command.add("-b:a");
            command.add("192k");
        } else {
            command.add("-an");
        }
        command.add("-movflags");
        command.add("+faststart");
        command.add(outputVideoPath.toString());
        return command;
    }

    static double frameProgress(int written, int totalFrames) {
        if (totalFrames <= 0) {
            return 1.0;
        }
        return STARTED_PROGRESS + (1.0 - STARTED_PROGRESS) * Math.min(1.0, (double) written / totalFrames);
    }

    private byte[] toBgr24(BufferedImage image, VideoEncodeSettings settings) {
        if (image.getType() != BufferedImage.TYPE_3BYTE_BGR
                || image.getWidth() != settings.width()
                || image.getHeight() != settings.height()) {
            throw new IllegalStateException("Frame must be a " + settings.width() + "x" + settings.height() + " TYPE_3BYTE_BGR image.");
        }
        return ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
    }

    private void waitQuietly(Process process) throws InterruptedException {
        if (!process.waitFor(5, TimeUnit.SECONDS)) {
            process.destroyForcibly();
        }
    }

    private String resolveFfmpegBinary() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return DEFAULT_FFMPEG_BINARY;
    }

    /**
     * Keeps the tail of FFmpeg's combined output so a failure can be reported with it.
     */
    private static final class OutputCollector implements Runnable {

        private final Process process;
        private final StringBuilder buffer = new StringBuilder();

        private OutputCollector(Process process) {
            this.process = process;
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    append(line);
                }
            } catch (IOException e) {
                logger.debug("FFmpeg output stream closed: {}", e.getMessage());
            }
        }

        private synchronized void append(String line) {
            buffer.append(line).append(System.lineSeparator());
            if (buffer.length() > MAX_CAPTURED_OUTPUT_CHARS) {
                buffer.delete(0, buffer.length() - MAX_CAPTURED_OUTPUT_CHARS);
            }
        }

        synchronized String text() {
            return buffer.toString();
        }
    }
}
