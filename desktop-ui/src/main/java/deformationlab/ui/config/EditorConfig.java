package deformationlab.ui.config;

import deformationlab.domain.source.EllipsoidSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.PropertySource;
import org.springframework.context.support.PropertySourcesPlaceholderConfigurer;

@Configuration
@ComponentScan("deformationlab.ui")
@PropertySource("classpath:application.properties")
public class EditorConfig {

    /**
     * Necesario para que @Value resuelva los placeholders del PropertySource cargado a mano.
     */
    @Bean
    public static PropertySourcesPlaceholderConfigurer propertySourcesPlaceholderConfigurer() {
        return new PropertySourcesPlaceholderConfigurer();
    }

    /**
     * Parámetros con los que arranca una fuente nueva y a los que vuelve "Restablecer".
     */
    @Bean
    public EllipsoidSource sourceDefaults(
            @Value("${deformationlab.source.default.easting:0}") int easting,
            @Value("${deformationlab.source.default.northing:0}") int northing,
            @Value("${deformationlab.source.default.depth:0}") int depth,
            @Value("${deformationlab.source.default.dVx:0}") int dVx,
            @Value("${deformationlab.source.default.dVy:0}") int dVy,
            @Value("${deformationlab.source.default.dVz:0}") int dVz,
            @Value("${deformationlab.source.default.rotation_x:0}") double rotationX,
            @Value("${deformationlab.source.default.rotation_y:0}") double rotationY,
            @Value("${deformationlab.source.default.rotation_z:0}") double rotationZ,
            @Value("${deformationlab.source.default.nu:0}") double nu) {
        return EllipsoidSource.builder()
                .easting(easting)
                .northing(northing)
                .depth(depth)
                .dVx(dVx)
                .dVy(dVy)
                .dVz(dVz)
                .rotationX(rotationX)
                .rotationY(rotationY)
                .rotationZ(rotationZ)
                .nu(nu)
                .build();
    }
}
