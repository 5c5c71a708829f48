package github.sarthakdev143.chat_renderer.config;

import github.sarthakdev143.chat_renderer.engine.audio.AudioSyncComposer;
import github.sarthakdev143.chat_renderer.engine.audio.ToneSynthesizer;
import github.sarthakdev143.chat_renderer.engine.audio.WavWriter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

@Configuration
public class RenderEngineConfig {

    public static final String RENDER_JOB_EXECUTOR = "renderJobExecutor";

    @Bean
    public ToneSynthesizer toneSynthesizer() {
        return new ToneSynthesizer();
    }

    @Bean
    public AudioSyncComposer audioSyncComposer(ToneSynthesizer toneSynthesizer) {
        return new AudioSyncComposer(toneSynthesizer);
    }

    @Bean
    public WavWriter wavWriter() {
        return new WavWriter();
    }

    /**
     * Runs render jobs off the request thread. Jobs beyond the pool size wait in the queue as
     * {@code queued}.
     */
    @Bean(name = RENDER_JOB_EXECUTOR)
    public ThreadPoolTaskExecutor renderJobExecutor(RenderProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.maxConcurrentJobs());
        executor.setMaxPoolSize(properties.maxConcurrentJobs());
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix("render-job-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        return executor;
    }
}
