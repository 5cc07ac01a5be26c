// File: src/main/java/com/example/docxcleaner/ContainerRewriter.java
package com.example.docxcleaner;

import com.example.docxcleaner.CleanerException.ErrorKind;
import com.example.docxcleaner.CleanerProperties.TimestampPolicy;
import com.example.docxcleaner.PartSelector.PartRole;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.compress.archivers.zip.X000A_NTFS;
import org.apache.commons.compress.archivers.zip.X5455_ExtendedTimestamp;
import org.apache.commons.compress.archivers.zip.Zip64ExtendedInformationExtraField;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.apache.commons.compress.archivers.zip.ZipExtraField;
import org.apache.commons.compress.archivers.zip.ZipFile;
import org.apache.poi.poifs.filesystem.FileMagic;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.zip.CRC32;

/**
 * 整包改写：文本部件走 解析→过滤→序列化，其余条目按压缩后原始字节复制（方法/时间/CRC/扩展字段不变）。
 * 先写同目录临时文件，全部成功后再改名到目标路径；任何失败都删除临时文件，不留下半成品。
 */
@Slf4j
public class ContainerRewriter {

    private static final String CONTENT_TYPES = "[Content_Types].xml";

    private final CleanerProperties props;

    public ContainerRewriter(CleanerProperties props) {
        this.props = props;
    }

    /** 待改写部件 */
    private static final class PartJob {
        final int entryIndex;
        final ZipArchiveEntry entry;
        final PartRole role;
        final byte[] payload;

        PartJob(int entryIndex, ZipArchiveEntry entry, PartRole role, byte[] payload) {
            this.entryIndex = entryIndex; this.entry = entry; this.role = role; this.payload = payload;
        }
    }

    /** 单个部件的改写结果；xml == null 表示原样复制 */
    private static final class PartOutcome {
        final byte[] xml;
        final int removed;
        final Map<Integer, Integer> counts;
        final String warning;

        PartOutcome(byte[] xml, int removed, Map<Integer, Integer> counts, String warning) {
            this.xml = xml; this.removed = removed; this.counts = counts; this.warning = warning;
        }
    }

    public CleanSummary process(Path input, Path output, Set<Integer> denylist) throws CleanerException {
        Set<Integer> deny = denylist == null ? Collections.emptySet() : denylist;
        checkPaths(input, output);
        checkContainer(input);

        Path dir = output.toAbsolutePath().getParent();
        Path tmp;
        try {
            tmp = Files.createTempFile(dir, "." + output.getFileName() + ".", ".tmp");
        } catch (IOException e) {
            throw new CleanerException(ErrorKind.IO_ERROR, null, "cannot create temp file in " + dir, e);
        }

        log.info("clean: input={}, output={}, denylist={}, parallelism={}",
                input, output, deny.size(), Math.max(1, props.getParallelism()));
        long t0 = System.currentTimeMillis();
        boolean published = false;
        try {
            CleanSummary summary = rewriteInto(input, tmp, deny);
            publish(tmp, output);
            published = true;
            log.info("done in {} ms: parts={}, rewritten={}, copied={}, removed={}",
                    System.currentTimeMillis() - t0, summary.getPartsProcessed(), summary.getPartsRewritten(),
                    summary.getEntriesCopied(), summary.getCharactersRemoved());
            return summary;
        } finally {
            if (!published) discard(tmp);
        }
    }

    private void checkPaths(Path input, Path output) throws CleanerException {
        if (!Files.isRegularFile(input)) {
            throw new CleanerException(ErrorKind.IO_ERROR, null, "input file not found: " + input);
        }
        if (input.toAbsolutePath().normalize().equals(output.toAbsolutePath().normalize())) {
            throw new CleanerException(ErrorKind.IO_ERROR, null, "output path must differ from input: " + output);
        }
        if (Files.exists(output)) {
            try {
                if (Files.isSameFile(input, output)) {
                    throw new CleanerException(ErrorKind.IO_ERROR, null, "output path must differ from input: " + output);
                }
            } catch (IOException e) {
                throw new CleanerException(ErrorKind.IO_ERROR, null, "cannot inspect output path " + output, e);
            }
            if (!props.isOverwrite()) {
                throw new CleanerException(ErrorKind.OUTPUT_EXISTS, null, "output file already exists: " + output);
            }
        }
    }

    private static void checkContainer(Path input) throws CleanerException {
        FileMagic magic;
        try {
            magic = FileMagic.valueOf(input.toFile());
        } catch (IOException e) {
            throw new CleanerException(ErrorKind.IO_ERROR, null, "cannot read input " + input, e);
        }
        if (magic == FileMagic.OLE2) {
            throw new CleanerException(ErrorKind.INVALID_CONTAINER, null,
                    "legacy Word 97-2003 (.doc) file, only .docx packages are supported");
        }
        if (magic != FileMagic.OOXML) {
            throw new CleanerException(ErrorKind.INVALID_CONTAINER, null, "not a zip package (" + magic + ")");
        }
    }

    private CleanSummary rewriteInto(Path input, Path tmp, Set<Integer> deny) throws CleanerException {
        try (ZipFile zip = openZip(input);
             ZipArchiveOutputStream zout = new ZipArchiveOutputStream(tmp.toFile())) {
            zout.setLevel(props.getCompressionLevel());

            List<ZipArchiveEntry> entries = Collections.list(zip.getEntries());
            if (zip.getEntry(CONTENT_TYPES) == null) {
                throw new CleanerException(ErrorKind.INVALID_CONTAINER, null, "missing " + CONTENT_TYPES);
            }

            List<PartJob> jobs = collectJobs(zip, entries);
            PartOutcome[] outcomes = rewriteAll(jobs, deny);

            // 按原始顺序写出
            PartOutcome[] byEntry = new PartOutcome[entries.size()];
            for (int j = 0; j < jobs.size(); j++) byEntry[jobs.get(j).entryIndex] = outcomes[j];

            int processed = 0, rewritten = 0, copied = 0;
            long removed = 0;
            Map<Integer, Integer> counts = new TreeMap<>();
            List<String> warnings = new ArrayList<>();
            for (int i = 0; i < entries.size(); i++) {
                ZipArchiveEntry e = entries.get(i);
                PartOutcome o = byEntry[i];
                if (o != null) {
                    processed++;
                    if (o.warning != null) warnings.add(e.getName() + ": " + o.warning);
                    removed += o.removed;
                    o.counts.forEach((cp, n) -> counts.merge(cp, n, Integer::sum));
                }
                if (o != null && o.xml != null) {
                    log.debug("rewrite [{}] {} (-{} chars)", i, e.getName(), o.removed);
                    writeRewritten(zout, e, o.xml);
                    rewritten++;
                } else {
                    log.debug("copy    [{}] {}", i, e.getName());
                    copyRaw(zip, zout, e);
                    if (o == null) copied++;
                }
            }
            zout.finish();
            return new CleanSummary(processed, rewritten, copied, removed,
                    Collections.unmodifiableMap(counts), Collections.unmodifiableList(warnings));
        } catch (IOException e) {
            throw new CleanerException(ErrorKind.IO_ERROR, null, "failed writing " + tmp, e);
        }
    }

    private static ZipFile openZip(Path input) throws CleanerException {
        try {
            return ZipFile.builder().setPath(input).get();
        } catch (IOException e) {
            throw new CleanerException(ErrorKind.INVALID_CONTAINER, null, "cannot open zip package " + input, e);
        }
    }

    private static List<PartJob> collectJobs(ZipFile zip, List<ZipArchiveEntry> entries) throws CleanerException {
        List<PartJob> jobs = new ArrayList<>();
        for (int i = 0; i < entries.size(); i++) {
            ZipArchiveEntry e = entries.get(i);
            if (e.isDirectory()) continue;
            PartRole role = PartSelector.classify(e.getName());
            if (!role.isTextBearing()) continue;
            if (!zip.canReadEntryData(e)) {
                // 加密或不支持的压缩方法：不读不改
                log.warn("cannot read {} (method {}), copying as-is", e.getName(), e.getMethod());
                continue;
            }
            try (InputStream in = zip.getInputStream(e)) {
                jobs.add(new PartJob(i, e, role, in.readAllBytes()));
            } catch (IOException ex) {
                throw new CleanerException(ErrorKind.IO_ERROR, e.getName(), "failed to read entry", ex);
            }
        }
        return jobs;
    }

    private PartOutcome[] rewriteAll(List<PartJob> jobs, Set<Integer> deny) throws CleanerException {
        PartOutcome[] out = new PartOutcome[jobs.size()];
        int parallelism = Math.min(Math.max(1, props.getParallelism()), jobs.size());
        if (parallelism <= 1) {
            for (int j = 0; j < jobs.size(); j++) out[j] = rewriteOne(jobs.get(j), deny);
            return out;
        }

        ExecutorService exec = Executors.newFixedThreadPool(parallelism);
        CompletionService<Integer> cs = new ExecutorCompletionService<>(exec);
        List<Future<Integer>> fs = new ArrayList<>(jobs.size());
        try {
            for (int j = 0; j < jobs.size(); j++) {
                final int idx = j;
                fs.add(cs.submit(() -> {
                    out[idx] = rewriteOne(jobs.get(idx), deny);
                    return idx;
                }));
            }
            for (int n = 0; n < jobs.size(); n++) {
                try {
                    cs.take().get();
                } catch (ExecutionException ee) {
                    for (Future<Integer> f : fs) f.cancel(true);
                    Throwable c = ee.getCause();
                    if (c instanceof CleanerException) throw (CleanerException) c;
                    throw new CleanerException(ErrorKind.IO_ERROR, null, "part rewrite failed", c);
                }
            }
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            for (Future<Integer> f : fs) f.cancel(true);
            throw new CleanerException(ErrorKind.IO_ERROR, null, "interrupted while rewriting parts", ie);
        } finally {
            exec.shutdownNow();
        }
        return out;
    }

    private static PartOutcome rewriteOne(PartJob job, Set<Integer> deny) throws CleanerException {
        String name = job.entry.getName();
        Map<Integer, Integer> counts = new HashMap<>();
        try {
            TextRunRewriter.Result r = TextRunRewriter.rewrite(job.payload, deny, job.role, name, counts);
            // 没删任何字符就按原字节复制
            return new PartOutcome(r.removed > 0 ? r.xml : null, r.removed, counts, null);
        } catch (CleanerException e) {
            if (e.getKind() != ErrorKind.UNSUPPORTED_PART) throw e;
            log.warn("{}: {}, copying as-is", name, e.getMessage());
            return new PartOutcome(null, 0, Collections.emptyMap(), e.getMessage());
        }
    }

    private void writeRewritten(ZipArchiveOutputStream zout, ZipArchiveEntry src, byte[] data) throws IOException {
        ZipArchiveEntry e = new ZipArchiveEntry(src.getName());
        int method = src.getMethod() == ZipArchiveEntry.STORED ? ZipArchiveEntry.STORED : ZipArchiveEntry.DEFLATED;
        e.setMethod(method);
        boolean keepTime = props.getTimestampPolicy() == TimestampPolicy.PRESERVE;
        e.setTime(keepTime ? src.getTime() : System.currentTimeMillis());
        for (ZipExtraField f : src.getExtraFields()) {
            if (f instanceof Zip64ExtendedInformationExtraField) continue;
            if (!keepTime && (f instanceof X5455_ExtendedTimestamp || f instanceof X000A_NTFS)) continue;
            e.addExtraField(f);
        }
        e.setComment(src.getComment());
        e.setInternalAttributes(src.getInternalAttributes());
        e.setExternalAttributes(src.getExternalAttributes());
        // 大小已知，seekable 输出才不会补 ZIP64 扩展字段
        e.setSize(data.length);
        if (method == ZipArchiveEntry.STORED) {
            CRC32 crc = new CRC32();
            crc.update(data);
            e.setCompressedSize(data.length);
            e.setCrc(crc.getValue());
        }
        zout.putArchiveEntry(e);
        zout.write(data);
        zout.closeArchiveEntry();
    }

    private static void copyRaw(ZipFile zip, ZipArchiveOutputStream zout, ZipArchiveEntry e) throws CleanerException {
        try (InputStream raw = zip.getRawInputStream(e)) {
            zout.addRawArchiveEntry(e, raw);
        } catch (IOException ex) {
            throw new CleanerException(ErrorKind.IO_ERROR, e.getName(), "failed to copy entry", ex);
        }
    }

    private void publish(Path tmp, Path output) throws CleanerException {
        try {
            if (props.isOverwrite()) {
                try {
                    Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException e) {
                    Files.move(tmp, output, StandardCopyOption.REPLACE_EXISTING);
                }
            } else {
                Files.move(tmp, output);
            }
        } catch (FileAlreadyExistsException e) {
            throw new CleanerException(ErrorKind.OUTPUT_EXISTS, null, "output file already exists: " + output, e);
        } catch (IOException e) {
            throw new CleanerException(ErrorKind.IO_ERROR, null, "cannot move result to " + output, e);
        }
    }

    private static void discard(Path tmp) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.warn("failed to delete partial output {}: {}", tmp, e.getMessage());
        }
    }
}
