package com.flamingo.ai.regdocs.service.research;

import com.flamingo.ai.regdocs.domain.model.PipelineResult;
import com.flamingo.ai.regdocs.domain.model.StoredFile;
import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/** Entry point of the document discovery and acquisition pipeline. */
public interface ResearchService {

  /**
   * Runs the whole pipeline for one substance. Never throws; failures are reported through a
   * result with status {@code error}.
   *
   * @param substanceName substance name as entered by the user
   * @return aggregate result of the run
   */
  PipelineResult research(String substanceName);

  /** Lists the PDFs already stored for a substance slug. */
  List<StoredFile> listFiles(String slug);

  /** Writes every stored PDF of a slug to {@code out} as a ZIP archive. */
  void writeArchive(String slug, OutputStream out) throws IOException;
}
