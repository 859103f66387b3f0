package com.asiainfo.dimensional.application.ingest;

import com.asiainfo.dimensional.domain.model.MetricDraft;

import java.util.List;

/**
 * 写库前已完成全部校验的上传内容
 */
public record ValidatedUpload(List<UploadRow> rows, List<MetricDraft> metrics, List<String> dimensionKeys) {

    public ValidatedUpload {
        rows = List.copyOf(rows);
        metrics = List.copyOf(metrics);
        dimensionKeys = List.copyOf(dimensionKeys);
    }
}
