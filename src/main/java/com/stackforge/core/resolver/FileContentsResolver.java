package com.stackforge.core.resolver;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * {@code !file_contents}: the text of a file.
 */
public class FileContentsResolver extends AbstractResolver {

    public static final String TAG = "file_contents";

    public FileContentsResolver(Object argument) {
        super(TAG, argument);
    }

    @Override
    public Object resolve(ResolutionContext context) {
        Path path = Path.of(stringArgument());
        try {
            return Files.readString(path);
        } catch (IOException e) {
            throw new ResolutionException("Could not read file '" + path + "': " + e.getMessage(), e);
        }
    }
}
