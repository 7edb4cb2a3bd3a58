package com.eyelevel.pdftoolkit.model;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A generated file held in the artifact store until it is downloaded or expires.
 *
 * @param name      The collision-free name under which the artifact can be retrieved.
 * @param path      Location of the artifact on ephemeral storage.
 * @param size      Size in bytes.
 * @param createdAt When the artifact was stored.
 */
public record Artifact(String name, Path path, long size, Instant createdAt) {
}
