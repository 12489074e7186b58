package com.fun.compute.api.model;

import java.util.Arrays;

public record InjectedFile(
        String path,
        byte[] contents
) {

    public InjectedFile {
        contents = contents.clone();
    }

    @Override
    public byte[] contents() {
        return contents.clone();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof InjectedFile file)) {
            return false;
        }
        return path.equals(file.path) && Arrays.equals(contents, file.contents);
    }

    @Override
    public int hashCode() {
        return 31 * path.hashCode() + Arrays.hashCode(contents);
    }

    @Override
    public String toString() {
        return "InjectedFile[path=" + path + ", length=" + contents.length + "]";
    }
}
