package com.bucketcopy.objectCopy.impl.disk;

import com.bucketcopy.objectCopy.*;
import com.bucketcopy.objectCopy.impl.CopyStoreBuilder;
import com.bucketcopy.objectCopy.impl.PartitionPlanner;
import com.bucketcopy.utils.Errors;
import com.google.inject.assistedinject.Assisted;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.file.DirectoryStream;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HexFormat;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import javax.inject.Inject;
import javax.persistence.EntityNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import static java.nio.charset.StandardCharsets.UTF_8;

/**
 * A MultipartCopyStore on the local filesystem. Objects live in
 * buckets/&lt;bucket&gt;/&lt;key&gt;.obj and each upload session is a directory
 * parts/&lt;uploadId&gt;/ holding a .KEY file plus one &lt;etag&gt;.partNNNN file
 * per copied part.
 *
 * Destination options are accepted but not stored.
 */
public class DiskMultipartCopyStore implements MultipartCopyStore
{
    private static final Logger LOG = LoggerFactory.getLogger(DiskMultipartCopyStore.class);
    private static final String KEY_POSTFIX = ".obj";
    private static final String KEY_FILE = ".KEY";
    private static final Pattern PART_FILE = Pattern.compile("([0-9a-f]+)\\.part(\\d{5})");

    private final Path _bucketsRoot;
    private final Path _partsRoot;

    public interface Factory {
        public DiskMultipartCopyStore create(CopyStoreBuilder builder);
    }

    public DiskMultipartCopyStore(File rootDir) {
        if ( null == rootDir ) {
            throw new IllegalArgumentException("Invalid Disk Storage Root: "+rootDir);
        }
        if ( rootDir.exists() && ! rootDir.isDirectory() ) {
            throw new IllegalArgumentException("Invalid Disk Storage Root: "+rootDir+" is not a directory");
        }
        _bucketsRoot = rootDir.toPath().toAbsolutePath().resolve("buckets");
        _partsRoot = rootDir.toPath().toAbsolutePath().resolve("parts");
        Errors.rethrow(() -> {
                Files.createDirectories(_bucketsRoot);
                Files.createDirectories(_partsRoot);
            });
    }

    @Inject
    public DiskMultipartCopyStore(@Assisted CopyStoreBuilder builder)
    {
        this(builder.getDiskStorageRoot());
        StoreType type = builder.getStoreType();
        if ( StoreType.DISK != type ) {
            throw new IllegalArgumentException("Invalid StoreType: "+type);
        }
    }

    public void createBucket(String bucketName) {
        if ( ! validFileName(bucketName) ) {
            throw new IllegalArgumentException("BucketName is invalid "+bucketName);
        }
        Errors.rethrow(() -> Files.createDirectories(_bucketsRoot.resolve(bucketName)));
    }

    public void put(ObjectKey objectKey, byte[] content) {
        Path objFile = toObjectPath(objectKey);
        Errors.rethrow(() -> {
                Files.createDirectories(objFile.getParent());
                Files.write(objFile, content);
            });
    }

    public byte[] get(ObjectKey objectKey) {
        Path objFile = toObjectPath(objectKey);
        if ( ! Files.exists(objFile) ) {
            throw new EntityNotFoundException("NotFound: "+objectKey+" bucketsRoot="+_bucketsRoot);
        }
        return Errors.rethrow(() -> Files.readAllBytes(objFile));
    }

    @Override
    public UploadSession initiateMultipartUpload(ObjectKey destination, UploadOptions options) {
        toObjectPath(destination);
        Path uploadDir = Errors.rethrow(() -> {
                Path dir = Files.createTempDirectory(_partsRoot, null);
                Files.write(dir.resolve(KEY_FILE), toBucketKey(destination).getBytes(UTF_8));
                return dir;
            });
        if ( null != options ) {
            LOG.debug("Ignoring options={} for {}", options, destination);
        }
        return UploadSession.builder()
            .bucket(destination.getBucket())
            .key(destination.getKey())
            .uploadId(uploadDir.getFileName().toString())
            .build();
    }

    @Override
    public PartResult copyPart(UploadSession session, ObjectKey source, PartRange range) {
        int partNum = range.getPartNum();
        if ( partNum < 1 || partNum > PartitionPlanner.MAXIMUM_PARTS ) {
            throw new IllegalArgumentException(
                "partNum must be between 1-"+PartitionPlanner.MAXIMUM_PARTS+" got="+partNum);
        }
        Path srcFile = toObjectPath(source);
        if ( ! Files.exists(srcFile) ) {
            throw new EntityNotFoundException("NotFound: "+source+" bucketsRoot="+_bucketsRoot);
        }
        return Errors.rethrow(() -> copyPartThrows(getUploadDir(session), srcFile, range));
    }

    private PartResult copyPartThrows(Path uploadDir, Path srcFile, PartRange range) throws Exception {
        long srcLength = Files.size(srcFile);
        if ( range.getStart() < 0 || range.getEnd() < range.getStart() || range.getEnd() >= srcLength ) {
            throw new IllegalArgumentException(
                "Range "+range.toHttpRange()+" is not within the source of length="+srcLength);
        }
        Path tmpFile = Files.createTempFile(uploadDir, null, ".tmp");
        boolean success = false;
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            try ( FileChannel channel = FileChannel.open(srcFile, StandardOpenOption.READ) ) {
                channel.position(range.getStart());
                InputStream in = new DigestInputStream(
                    new LimitingInputStream(Channels.newInputStream(channel), range.getLength()),
                    md);
                Files.copy(in, tmpFile, StandardCopyOption.REPLACE_EXISTING);
            }
            String etag = HexFormat.of().formatHex(md.digest());
            // A part number copied again replaces the earlier part:
            deletePart(uploadDir, range.getPartNum());
            Files.move(tmpFile, uploadDir.resolve(toPartFileName(etag, range.getPartNum())));
            success = true;
            return PartResult.builder()
                .partNum(range.getPartNum())
                .etag(etag)
                .build();
        } finally {
            if ( ! success ) Files.deleteIfExists(tmpFile);
        }
    }

    @Override
    public CompletedCopy completeMultipartUpload(UploadSession session, List<PartResult> parts) {
        return Errors.rethrow(() -> completeThrows(session, parts));
    }

    private CompletedCopy completeThrows(UploadSession session, List<PartResult> parts) throws IOException {
        Path uploadDir = getUploadDir(session);
        if ( parts.isEmpty() ) {
            throw new IllegalArgumentException("At least one part is required to complete "+session);
        }
        List<Path> partFiles = new ArrayList<>(parts.size());
        int prevPartNum = 0;
        for ( int i=0; i < parts.size(); i++ ) {
            PartResult part = parts.get(i);
            if ( part.getPartNum() <= prevPartNum ) {
                throw new IllegalArgumentException("Parts must be in ascending order, got "+parts);
            }
            prevPartNum = part.getPartNum();
            Path partFile = uploadDir.resolve(toPartFileName(part.getEtag(), part.getPartNum()));
            if ( ! Files.exists(partFile) ) {
                throw new EntityNotFoundException("InvalidPart: "+part+" of "+session);
            }
            if ( i < parts.size() - 1 && Files.size(partFile) < PartitionPlanner.MINIMUM_PART_SIZE ) {
                throw new PartTooSmallException(
                    "PartTooSmall: part="+part.getPartNum()+" size="+Files.size(partFile)+" of "+session);
            }
            partFiles.add(partFile);
        }

        Path objFile = toObjectPath(session.getDestination());
        Files.createDirectories(objFile.getParent());
        Path tmpFile = Files.createTempFile(uploadDir, null, ".tmp");
        MessageDigest md = Errors.rethrow(() -> MessageDigest.getInstance("MD5"));
        try ( OutputStream out = Files.newOutputStream(tmpFile) ) {
            for ( Path partFile : partFiles ) {
                Files.copy(partFile, out);
            }
        }
        for ( PartResult part : parts ) {
            md.update(HexFormat.of().parseHex(part.getEtag()));
        }
        Files.move(tmpFile, objFile, StandardCopyOption.REPLACE_EXISTING);
        deleteDir(uploadDir);
        return CompletedCopy.builder()
            .bucket(session.getBucket())
            .key(session.getKey())
            .location(objFile.toUri().toString())
            // Same form as S3, the md5 of the part md5s with the part count:
            .etag(HexFormat.of().formatHex(md.digest())+"-"+partFiles.size())
            .uploadId(session.getUploadId())
            .build();
    }

    @Override
    public void abortMultipartUpload(UploadSession session) {
        Errors.rethrow(() -> deleteDir(getUploadDir(session)));
    }

    @Override
    public List<PartResult> listParts(UploadSession session) {
        Path uploadDir;
        try {
            uploadDir = getUploadDir(session);
        } catch ( EntityNotFoundException ex ) {
            return Collections.emptyList();
        }
        return Errors.rethrow(() -> listPartsThrows(uploadDir));
    }

    private List<PartResult> listPartsThrows(Path uploadDir) throws IOException {
        List<PartResult> parts = new ArrayList<>();
        try ( DirectoryStream<Path> dirStream = Files.newDirectoryStream(uploadDir) ) {
            for ( Path file : dirStream ) {
                Matcher matcher = PART_FILE.matcher(file.getFileName().toString());
                if ( ! matcher.matches() ) continue;
                parts.add(
                    PartResult.builder()
                    .partNum(Integer.parseInt(matcher.group(2)))
                    .etag(matcher.group(1))
                    .size(Files.size(file))
                    .build());
            }
        } catch ( NoSuchFileException ex ) {
            // Aborted concurrently.
            return Collections.emptyList();
        }
        parts.sort(Comparator.comparingInt(PartResult::getPartNum));
        return Collections.unmodifiableList(parts);
    }

    private void deletePart(Path uploadDir, int partNum) throws IOException {
        String suffix = String.format(".part%05d", partNum);
        try ( DirectoryStream<Path> dirStream = Files.newDirectoryStream(uploadDir, "*"+suffix) ) {
            for ( Path file : dirStream ) {
                Files.deleteIfExists(file);
            }
        }
    }

    private static void deleteDir(Path directory) throws IOException {
        Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException ex) throws IOException {
                    if ( null != ex ) throw ex;
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
    }

    private Path getUploadDir(UploadSession session) {
        String uploadId = session.getUploadId();
        if ( null == uploadId || uploadId.isEmpty() || uploadId.startsWith(".") || uploadId.contains("/") ) {
            throw new IllegalArgumentException("Invalid session.uploadId "+session);
        }
        Path uploadDir = _partsRoot.resolve(uploadId);
        Path keyFile = uploadDir.resolve(KEY_FILE);
        if ( ! Files.exists(keyFile) ) {
            throw new EntityNotFoundException("NotFound: "+session+" partsRoot="+_partsRoot);
        }
        String bucketKey = Errors.rethrow(() -> new String(Files.readAllBytes(keyFile), UTF_8));
        String expectBucketKey = toBucketKey(session.getDestination());
        if ( ! bucketKey.equals(expectBucketKey) ) {
            throw new EntityNotFoundException(
                "NotFound: expected bucketKey="+expectBucketKey+" session="+session+" partsRoot="+_partsRoot);
        }
        return uploadDir;
    }

    private Path toObjectPath(ObjectKey objectKey) {
        if ( null == objectKey || ! validFileName(objectKey.getBucket()) ) {
            throw new IllegalArgumentException("objectKey.bucket is invalid "+objectKey);
        }
        if ( ! validCanonicalRelativePath(objectKey.getKey()) ) {
            throw new IllegalArgumentException("objectKey.key is invalid "+objectKey);
        }
        Path bucketRoot = _bucketsRoot.resolve(objectKey.getBucket());
        if ( ! Files.isDirectory(bucketRoot) ) {
            throw new EntityNotFoundException("Bucket "+objectKey.getBucket()+" does not exist");
        }
        String key = objectKey.getKey();
        if ( key.endsWith("/") ) key = key.substring(0, key.length()-1);
        return bucketRoot.resolve(key+KEY_POSTFIX);
    }

    private static String toBucketKey(ObjectKey objectKey) {
        return objectKey.getBucket()+"/"+objectKey.getKey();
    }

    private static String toPartFileName(String etag, int partNum) {
        return String.format("%s.part%05d", etag, partNum);
    }

    private static boolean validFileName(String name) {
        if ( null == name || name.isEmpty() ) return false;
        if ( ".".equals(name) ) return false;
        if ( "..".equals(name) ) return false;
        if ( name.contains("/") ) return false;
        if ( name.contains(File.separator) ) return false;
        return true;
    }

    private static boolean validCanonicalRelativePath(String name) {
        if ( null == name || name.isEmpty() ) return false;
        for ( String part : name.split("/") ) {
            if ( ! validFileName(part) ) return false;
        }
        return true;
    }
}
