package com.phillippitts.audioprep.service.audio;

import com.phillippitts.audioprep.exception.InvalidAudioException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioFileFormat;
import javax.sound.sampled.AudioFormat;
import javax.sound.sampled.AudioInputStream;
import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.UnsupportedAudioFileException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * {@link AudioReader} backed by Java Sound.
 *
 * <p>Any encoding Java Sound can convert to 16-bit signed little-endian PCM is accepted;
 * samples are scaled to {@code [-1, 1)} by dividing by 32768.
 */
@Component
public class JavaSoundAudioReader implements AudioReader {
    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioReader.class);

    private static final int BYTES_PER_SAMPLE = 2;
    private static final float PCM16_SCALE = 32768f;

    @Override
    public AudioInfo info(Path file) {
        Objects.requireNonNull(file, "file must not be null");
        requireRegularFile(file);
        try {
            AudioFileFormat fileFormat = AudioSystem.getAudioFileFormat(file.toFile());
            AudioFormat format = fileFormat.getFormat();
            long frames = fileFormat.getFrameLength();
            if (frames == AudioSystem.NOT_SPECIFIED) {
                try (AudioInputStream in = AudioSystem.getAudioInputStream(file.toFile())) {
                    frames = in.getFrameLength();
                }
            }
            if (frames == AudioSystem.NOT_SPECIFIED) {
                throw new InvalidAudioException(file.toString(), "frame count not available");
            }
            return new AudioInfo(format.getSampleRate(), frames, format.getChannels());
        } catch (UnsupportedAudioFileException e) {
            throw new InvalidAudioException(file.toString(), "unsupported audio format", e);
        } catch (IOException e) {
            throw new InvalidAudioException(file.toString(), "I/O error reading header", e);
        }
    }

    @Override
    public PcmBlock read(Path file, long startFrame, int frameCount) {
        Objects.requireNonNull(file, "file must not be null");
        if (startFrame < 0) {
            throw new IllegalArgumentException("startFrame must be >= 0, got: " + startFrame);
        }
        if (frameCount < 0) {
            throw new IllegalArgumentException("frameCount must be >= 0, got: " + frameCount);
        }
        requireRegularFile(file);
        try (AudioInputStream source = AudioSystem.getAudioInputStream(file.toFile());
             AudioInputStream pcm = toPcm16Le(source)) {
            AudioFormat format = pcm.getFormat();
            int channels = format.getChannels();
            int frameSize = channels * BYTES_PER_SAMPLE;

            long skipped = skipFully(pcm, startFrame * frameSize, frameSize);
            if (skipped < startFrame * frameSize) {
                LOG.debug("Start frame {} is past the end of {}", startFrame, file);
                return new PcmBlock(new float[0], channels, format.getSampleRate());
            }

            byte[] bytes = new byte[Math.multiplyExact(frameCount, frameSize)];
            int read = readFully(pcm, bytes);
            int usable = read - (read % frameSize);
            return new PcmBlock(toFloats(bytes, usable), channels, format.getSampleRate());
        } catch (UnsupportedAudioFileException e) {
            throw new InvalidAudioException(file.toString(), "unsupported audio format", e);
        } catch (IllegalArgumentException e) {
            throw new InvalidAudioException(file.toString(), "cannot convert to 16-bit PCM", e);
        } catch (IOException e) {
            throw new InvalidAudioException(file.toString(), "I/O error reading samples", e);
        }
    }

    private static void requireRegularFile(Path file) {
        if (!Files.isRegularFile(file)) {
            throw new InvalidAudioException(file.toString(), "file does not exist");
        }
    }

    private static AudioInputStream toPcm16Le(AudioInputStream source) {
        AudioFormat src = source.getFormat();
        boolean alreadyPcm16Le = AudioFormat.Encoding.PCM_SIGNED.equals(src.getEncoding())
                && src.getSampleSizeInBits() == 16
                && !src.isBigEndian();
        if (alreadyPcm16Le) {
            return source;
        }
        AudioFormat target = new AudioFormat(
                AudioFormat.Encoding.PCM_SIGNED,
                src.getSampleRate(),
                16,
                src.getChannels(),
                src.getChannels() * BYTES_PER_SAMPLE,
                src.getSampleRate(),
                false);
        return AudioSystem.getAudioInputStream(target, source);
    }

    private static long skipFully(AudioInputStream in, long bytes, int frameSize) throws IOException {
        long remaining = bytes;
        byte[] frame = null;
        while (remaining > 0) {
            long n = in.skip(remaining);
            if (n <= 0) {
                // skip() may return 0 before EOF; AudioInputStream only reads whole frames
                if (frame == null) {
                    frame = new byte[frameSize];
                }
                n = in.read(frame, 0, (int) Math.min(frameSize, remaining));
                if (n <= 0) {
                    break;
                }
            }
            remaining -= n;
        }
        return bytes - remaining;
    }

    private static int readFully(AudioInputStream in, byte[] buffer) throws IOException {
        int total = 0;
        while (total < buffer.length) {
            int n = in.read(buffer, total, buffer.length - total);
            if (n < 0) {
                break;
            }
            total += n;
        }
        return total;
    }

    private static float[] toFloats(byte[] bytes, int length) {
        float[] out = new float[length / BYTES_PER_SAMPLE];
        for (int i = 0, j = 0; j < out.length; i += BYTES_PER_SAMPLE, j++) {
            short s = (short) ((bytes[i] & 0xFF) | (bytes[i + 1] << 8));
            out[j] = s / PCM16_SCALE;
        }
        return out;
    }
}
