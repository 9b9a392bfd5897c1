package com.pkgmeta.core.normalize;

import com.pkgmeta.core.metadata.AttributeResolver;
import com.pkgmeta.core.metadata.MetadataSource;
import com.pkgmeta.core.model.DeclaredLicense;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits trove classifiers into license classifiers and all others, and builds
 * the declared license from the free-text license field plus license classifiers.
 */
public final class ClassifierSplitter {

    static final String LICENSE_PREFIX = "License";
    static final String UNKNOWN_LICENSE = "UNKNOWN";

    private ClassifierSplitter() {
        // Utility class
    }

    /**
     * Partitioned classifiers.
     *
     * @param licenseClassifiers classifiers starting with {@code License}
     * @param otherClassifiers every other classifier, in order
     */
    public record ClassifierSplit(List<String> licenseClassifiers, List<String> otherClassifiers) {
        public ClassifierSplit {
            licenseClassifiers = List.copyOf(licenseClassifiers);
            otherClassifiers = List.copyOf(otherClassifiers);
        }
    }

    /**
     * Reads the {@code Classifier} (or {@code Classifiers}) field and partitions it.
     *
     * @param source metadata source
     * @return partitioned classifiers
     */
    public static ClassifierSplit split(MetadataSource source) {
        List<Object> classifiers = AttributeResolver.getAttributes(source, "Classifier");
        if (classifiers.isEmpty()) {
            classifiers = AttributeResolver.getAttributes(source, "Classifiers");
        }
        List<String> license = new ArrayList<>();
        List<String> other = new ArrayList<>();
        for (Object entry : classifiers) {
            if (entry == null) {
                continue;
            }
            String classifier = entry.toString().trim();
            if (classifier.isEmpty()) {
                continue;
            }
            if (classifier.startsWith(LICENSE_PREFIX)) {
                license.add(classifier);
            } else {
                other.add(classifier);
            }
        }
        return new ClassifierSplit(license, other);
    }

    /**
     * Builds the declared license of a source.
     *
     * <p>The {@code License} field is kept verbatim unless it is the
     * {@code UNKNOWN} placeholder; {@code License-Expression} is used when
     * {@code License} is absent or the placeholder.
     *
     * @param source metadata source
     * @return declared license, possibly empty
     */
    public static DeclaredLicense declaredLicense(MetadataSource source) {
        String license = AttributeResolver.getString(source, "License");
        if (license == null || UNKNOWN_LICENSE.equals(license)) {
            license = AttributeResolver.getString(source, "License-Expression");
        }
        List<String> licenseClassifiers = split(source).licenseClassifiers();
        if (license == null && licenseClassifiers.isEmpty()) {
            return DeclaredLicense.none();
        }
        return new DeclaredLicense(license, licenseClassifiers);
    }
}
