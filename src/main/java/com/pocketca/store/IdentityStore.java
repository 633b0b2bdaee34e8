package com.pocketca.store;

import com.pocketca.crypto.KeyPairVerifier;
import com.pocketca.crypto.PemCodec;
import com.pocketca.exception.PkiErrorCode;
import com.pocketca.exception.PkiException;
import com.pocketca.model.Identity;
import org.bouncycastle.cert.X509CRLHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermission;
import java.security.PrivateKey;
import java.security.cert.X509CRL;
import java.security.cert.X509Certificate;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Flat directory of PEM artifacts: {@code X.crt}, {@code X.key} and {@code X.crl}.
 *
 * <p>Writes go to a temporary file in the same directory and are renamed
 * into place, so a reader never sees a partially written artifact.</p>
 */
public class IdentityStore {

    private static final Logger logger = LoggerFactory.getLogger(IdentityStore.class);

    public static final String CERTIFICATE_SUFFIX = ".crt";
    public static final String KEY_SUFFIX = ".key";
    public static final String CRL_SUFFIX = ".crl";

    private static final Set<PosixFilePermission> KEY_FILE_PERMISSIONS = EnumSet.of(
        PosixFilePermission.OWNER_READ,
        PosixFilePermission.OWNER_WRITE
    );

    private static final Set<PosixFilePermission> PUBLIC_FILE_PERMISSIONS = EnumSet.of(
        PosixFilePermission.OWNER_READ,
        PosixFilePermission.OWNER_WRITE,
        PosixFilePermission.GROUP_READ,
        PosixFilePermission.OTHERS_READ
    );

    private final Path directory;
    private final PemCodec pemCodec;

    public IdentityStore(Path directory) {
        this(directory, new PemCodec());
    }

    public IdentityStore(Path directory, PemCodec pemCodec) {
        this.directory = directory;
        this.pemCodec = pemCodec;
    }

    public Path getDirectory() {
        return directory;
    }

    public Path certificatePath(String name) {
        return directory.resolve(name + CERTIFICATE_SUFFIX);
    }

    public Path keyPath(String name) {
        return directory.resolve(name + KEY_SUFFIX);
    }

    public Path crlPath(String name) {
        return directory.resolve(name + CRL_SUFFIX);
    }

    /**
     * True if either the certificate or the key for {@code name} is present.
     */
    public boolean exists(String name) {
        return Files.exists(certificatePath(name)) || Files.exists(keyPath(name));
    }

    /**
     * @throws PkiException IDENTITY_ALREADY_EXISTS if {@code name} is taken
     */
    public void checkAvailable(String name) {
        if (exists(name)) {
            throw PkiException.identityAlreadyExists(name);
        }
    }

    /**
     * Load a signing authority: its certificate and the matching private key.
     *
     * @throws PkiException SIGNING_AUTHORITY_NOT_FOUND, CA_KEY_NOT_FOUND or INVALID_SIGNING_AUTHORITY
     */
    public Identity loadAuthority(String name) {
        Path certPath = certificatePath(name);
        if (!Files.exists(certPath)) {
            throw PkiException.signingAuthorityNotFound(name);
        }

        X509Certificate certificate;
        try {
            certificate = pemCodec.decodeCertificate(Files.readAllBytes(certPath));
        } catch (IOException e) {
            throw new PkiException(PkiErrorCode.INVALID_SIGNING_AUTHORITY,
                "Cannot read certificate for signing authority: " + name, e);
        }

        PrivateKey privateKey;
        try {
            privateKey = pemCodec.decodePrivateKey(Files.readAllBytes(keyPath(name)));
        } catch (IOException e) {
            throw PkiException.caKeyNotFound(name, e);
        }

        if (!KeyPairVerifier.matches(privateKey, certificate.getPublicKey())) {
            throw PkiException.invalidSigningAuthority(name);
        }
        return new Identity(name, privateKey, certificate);
    }

    /**
     * @throws PkiException IDENTITY_NOT_FOUND if the certificate is missing or unreadable
     */
    public X509Certificate loadCertificate(String name) {
        Path certPath = certificatePath(name);
        if (!Files.exists(certPath)) {
            throw PkiException.identityNotFound(name);
        }
        try {
            return pemCodec.decodeCertificate(Files.readAllBytes(certPath));
        } catch (IOException e) {
            throw new PkiException(PkiErrorCode.IDENTITY_NOT_FOUND,
                "Cannot read certificate: " + name, e);
        }
    }

    /**
     * Read the CRL published by {@code authority}, if any.
     *
     * @throws PkiException MALFORMED_CRL if the file exists but does not parse
     */
    public Optional<X509CRLHolder> loadCrl(String authority) {
        Path path = crlPath(authority);
        if (!Files.exists(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(pemCodec.decodeCrlHolder(Files.readAllBytes(path)));
        } catch (IOException e) {
            throw PkiException.malformedCrl(authority, e);
        }
    }

    /**
     * Persist a new identity. The key lands first, then the certificate;
     * if the certificate cannot be placed the key is removed again.
     */
    public void save(Identity identity) {
        String name = identity.getName();
        byte[] keyPem = pemCodec.encode(identity.getPrivateKey());
        byte[] certPem = pemCodec.encode(identity.getCertificate());

        Path keyTemp = null;
        Path certTemp = null;
        try {
            Files.createDirectories(directory);
            keyTemp = writeTemp(name, keyPem, KEY_FILE_PERMISSIONS);
            certTemp = writeTemp(name, certPem, PUBLIC_FILE_PERMISSIONS);

            Path keyTarget = keyPath(name);
            moveIntoPlace(keyTemp, keyTarget);
            keyTemp = null;
            try {
                moveIntoPlace(certTemp, certificatePath(name));
                certTemp = null;
            } catch (IOException e) {
                deleteQuietly(keyTarget);
                throw e;
            }
            logger.info("Saved {} and {} to {}", name + CERTIFICATE_SUFFIX, name + KEY_SUFFIX, directory);
        } catch (IOException e) {
            throw PkiException.filesystemUnavailable(directory.toString(), e);
        } finally {
            deleteQuietly(keyTemp);
            deleteQuietly(certTemp);
        }
    }

    /**
     * Replace the CRL of {@code authority}.
     */
    public void saveCrl(String authority, X509CRL crl) {
        byte[] pem = pemCodec.encode(crl);
        Path temp = null;
        try {
            Files.createDirectories(directory);
            temp = writeTemp(authority, pem, PUBLIC_FILE_PERMISSIONS);
            moveIntoPlace(temp, crlPath(authority));
            temp = null;
        } catch (IOException e) {
            throw PkiException.filesystemUnavailable(crlPath(authority).toString(), e);
        } finally {
            deleteQuietly(temp);
        }
    }

    /**
     * Write a file that must not exist yet.
     *
     * @throws PkiException IDENTITY_ALREADY_EXISTS if the file is present
     */
    public Path writeNew(String fileName, byte[] content) {
        Path target = directory.resolve(fileName);
        try {
            Files.createDirectories(directory);
            Files.write(target, content, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            setPermissions(target, PUBLIC_FILE_PERMISSIONS);
            return target;
        } catch (FileAlreadyExistsException e) {
            throw PkiException.identityAlreadyExists(fileName);
        } catch (IOException e) {
            throw PkiException.filesystemUnavailable(target.toString(), e);
        }
    }

    private Path writeTemp(String name, byte[] content, Set<PosixFilePermission> permissions) throws IOException {
        Path temp = Files.createTempFile(directory, "." + name + "-", ".tmp");
        setPermissions(temp, permissions);
        Files.write(temp, content);
        return temp;
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            logger.debug("Atomic move not supported in {}, falling back to replace", directory);
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private void setPermissions(Path path, Set<PosixFilePermission> permissions) {
        try {
            Files.setPosixFilePermissions(path, permissions);
        } catch (UnsupportedOperationException e) {
            logger.debug("POSIX permissions not supported for {}", path);
        } catch (IOException e) {
            logger.warn("Could not set permissions on {}: {}", path, e.getMessage());
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not remove {}: {}", path, e.getMessage());
        }
    }
}
