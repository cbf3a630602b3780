package ai.disko.csi;

import ai.disko.csi.configs.ServiceConfig;
import ai.disko.csi.naming.ClaimAnnotationNameSource;
import ai.disko.csi.naming.ClaimLookup;
import ai.disko.csi.naming.RequestParametersNameSource;
import ai.disko.csi.naming.VolumeNameSource;
import io.micronaut.context.BeanProvider;
import io.micronaut.context.annotation.Factory;
import jakarta.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

@Factory
public class BeanFactory {
    private static final Logger LOG = LogManager.getLogger(BeanFactory.class);

    @Singleton
    public VolumeNameSource volumeNameSource(ServiceConfig config, ServiceConfig.VolumeNameConfig volumeNameConfig,
                                             BeanProvider<ClaimLookup> claimLookup)
    {
        LOG.info("Volume names are taken from: {}", volumeNameConfig.getSource());

        return switch (volumeNameConfig.getSource()) {
            case Parameters -> new RequestParametersNameSource();
            case Annotation -> new ClaimAnnotationNameSource(claimLookup.get(), config.volumeNameAnnotationKey());
            case Disabled -> VolumeNameSource.NONE;
        };
    }
}
