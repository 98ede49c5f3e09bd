package com.gentoro.annomics;

public class AnnomicsApp {

  private static final org.slf4j.Logger log =
      com.gentoro.annomics.logging.LoggingService.getLogger(AnnomicsApp.class);

  public static void main(String[] args) {
    try {
      Annomics app = new Annomics(args);
      app.initialize();
      // Blocks until stdin is closed
      app.serve();
    } catch (Exception e) {
      log.error("Application failed to start", e);
      System.exit(1);
    }
  }
}
