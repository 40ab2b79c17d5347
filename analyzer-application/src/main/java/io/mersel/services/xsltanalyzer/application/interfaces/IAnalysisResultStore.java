package io.mersel.services.xsltanalyzer.application.interfaces;

import io.mersel.services.xsltanalyzer.application.models.AnalysisResult;

import java.util.Optional;

/**
 * Analiz sonuçlarının opak dosya kimliğiyle saklandığı kalıcılık noktası.
 */
public interface IAnalysisResultStore {

    void save(AnalysisResult result);

    Optional<AnalysisResult> find(String fileId);

    long size();
}
