package org.dxworks.fortframe.analyzer.correlation;

import org.dxworks.fortframe.FortframeConfig;
import org.dxworks.fortframe.model.ExternalModule;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Modules that live outside the project: the intrinsic and standard library modules, plus the ones named in the
 * {@code extraModules} setting. A {@code use} of one of them resolves to an {@link ExternalModule} link.
 */
public final class IntrinsicModules {

    private static final Map<String, String> INTRINSIC = new LinkedHashMap<>();

    static {
        INTRINSIC.put("iso_fortran_env", "http://fortranwiki.org/fortran/show/iso_fortran_env");
        INTRINSIC.put("iso_c_binding", "http://fortranwiki.org/fortran/show/iso_c_binding");
        INTRINSIC.put("ieee_arithmetic", "http://fortranwiki.org/fortran/show/ieee_arithmetic");
        INTRINSIC.put("ieee_exceptions", "http://fortranwiki.org/fortran/show/IEEE+arithmetic");
        INTRINSIC.put("ieee_features", "http://fortranwiki.org/fortran/show/IEEE+arithmetic");
        INTRINSIC.put("openacc", "https://www.openacc.org/sites/default/files/inline-images/Specification/OpenACC.3.0.pdf#page=85");
        INTRINSIC.put("omp_lib", "https://www.openmp.org/spec-html/5.1/openmpch3.html#x156-1890003");
        INTRINSIC.put("mpi", "http://www.mpi-forum.org/docs/mpi-3.1/mpi31-report/node410.htm");
        INTRINSIC.put("mpi_f08", "http://www.mpi-forum.org/docs/mpi-3.1/mpi31-report/node409.htm");
    }

    private IntrinsicModules() {
    }

    /**
     * Lower-cased module name to external module, intrinsic modules first. An extra module with the name of an
     * intrinsic one replaces its link.
     */
    public static Map<String, ExternalModule> forConfig(FortframeConfig config) {
        Map<String, ExternalModule> modules = new LinkedHashMap<>();
        INTRINSIC.forEach((name, url) -> modules.put(name, new ExternalModule(name, url)));
        config.getExtraModules().forEach((name, url) ->
                modules.put(name.strip().toLowerCase(Locale.ROOT), new ExternalModule(name.strip(), url.strip())));
        return modules;
    }
}
