package com.myorg.choirsplit.service;

import com.myorg.choirsplit.model.SplitReport;

import java.io.IOException;

public interface SplitReporter {

    void write(SplitReport report) throws IOException;
}
