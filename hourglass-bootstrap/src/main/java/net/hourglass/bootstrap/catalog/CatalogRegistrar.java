package net.hourglass.bootstrap.catalog;

import net.hourglass.bootstrap.props.HourglassProperties;
import net.hourglass.core.model.Job;
import net.hourglass.core.spi.JobRepository;
import net.hourglass.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 설정에 선언된 잡을 이름 기준으로 생성/갱신 (멱등) */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final JobRepository jobs;
    private final TxRunner tx;

    public CatalogRegistrar(JobRepository jobs, TxRunner tx) {
        this.jobs = jobs;
        this.tx = tx;
    }

    public int register(HourglassProperties.Catalog catalog) throws Exception {
        int n = 0;
        for (var def : catalog.getJobs()) {
            upsert(def);
            n++;
        }
        return n;
    }

    private void upsert(HourglassProperties.JobDef def) throws Exception {
        if (def.getName() == null || def.getFrequency() == null) {
            throw new IllegalArgumentException("job.name and job.frequency are required");
        }
        Job declared = toJob(def);

        long id = tx.required(() -> {
            var existing = jobs.findByName(def.getName());
            if (existing.isEmpty()) return jobs.create(declared);
            long jobId = existing.get().id();
            jobs.update(declared.withId(jobId));
            return jobId;
        });
        log.info("Catalog registered: job='{}' id={} {}", def.getName(), id, def.getFrequency());
    }

    static Job toJob(HourglassProperties.JobDef def) {
        var params = new Job.ExecutorParams(def.getSourceUrl(), def.getOutputRoot(), def.getPreferredLangs(),
                def.isDownload());
        return Job.ofNew(def.getName(), Job.Frequency.from(def.getFrequency()), def.getByHour(), def.getByMinute(),
                def.getWeekday(), def.getJitterSec(), params).withEnabled(def.isEnabled());
    }
}
