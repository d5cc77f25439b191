package com.conveyor.engine.collaborator;

import com.conveyor.engine.tool.ToolAdapter;
import com.conveyor.engine.tool.ToolInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.nio.file.Path;

/**
 * Uploads through the {@code aws s3 cp} CLI. The bucket may be configured
 * with or without the {@code s3://} scheme and with a key prefix, e.g.
 * {@code s3://ci-reports/trivy}.
 */
@Component
public class S3CliObjectStorage implements ObjectStorage {

    private static final Logger log = LoggerFactory.getLogger(S3CliObjectStorage.class);

    private final ToolAdapter tools;
    private final String      bucket;

    public S3CliObjectStorage(ToolAdapter tools, @Value("${conveyor.storage.bucket:}") String bucket) {
        this.tools  = tools;
        this.bucket = stripScheme(bucket);
    }

    @Override
    public URI upload(Path localPath, String remoteKey) {
        URI target = URI.create("s3://" + bucket + "/" + remoteKey);
        tools.invoke(ToolInvocation.of("aws", "s3", "cp", localPath.toString(), target.toString()))
                .orThrow("Upload of " + localPath + " to " + target);
        log.info("Uploaded {} to {}", localPath, target);
        return target;
    }

    static String stripScheme(String bucket) {
        String name = bucket.startsWith("s3://") ? bucket.substring("s3://".length()) : bucket;
        while (name.endsWith("/")) {
            name = name.substring(0, name.length() - 1);
        }
        return name;
    }
}
