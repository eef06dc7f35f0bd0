package com.jacobsonmt.contributions;

import com.jacobsonmt.contributions.pipeline.Pipeline;
import com.jacobsonmt.contributions.services.JobManager;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.junit4.SpringRunner;

import static org.assertj.core.api.Assertions.assertThat;

@RunWith( SpringRunner.class )
@SpringBootTest(properties = {"contributions.settings.concurrent-jobs=3"})
public class ContributionsApplicationTests {

    @Autowired
    private JobManager jobManager;

    @Autowired
    private Pipeline pipeline;

    @Test
    public void contextLoads() {
        assertThat( pipeline.size() ).isEqualTo( 2 );
        assertThat( jobManager.getQueueSummary().getWorkers() ).isEqualTo( 3 );
    }
}
