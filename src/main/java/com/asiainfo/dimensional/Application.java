package com.asiainfo.dimensional;

import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 应用程序主类
 * Quarkus启动入口
 */
@QuarkusMain
public class Application {

    public static void main(String[] args) {
        Quarkus.run(App.class, args);
    }

    public static class App implements QuarkusApplication {

        private static final Logger log = LoggerFactory.getLogger(App.class);

        @Override
        public int run(String... args) {
            log.info("=== Dimensional Metrics Store started ===");
            log.info("  ingest:  POST /v1/metrics/upload");
            log.info("  query:   POST /v1/query/timeseries | /aggregate | /topk, GET /v1/query/latest");
            log.info("  catalog: /v1/metrics, /v1/dimensions");
            Quarkus.waitForExit();
            return 0;
        }
    }
}
