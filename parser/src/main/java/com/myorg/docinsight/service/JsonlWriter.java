package com.myorg.docinsight.service;

import java.io.File;
import java.io.IOException;
import java.util.List;

public interface JsonlWriter<T> {
    void write(File outputFile, List<T> data) throws IOException;
}
