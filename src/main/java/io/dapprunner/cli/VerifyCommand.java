package io.dapprunner.cli;

import io.dapprunner.descriptor.DappDescriptor;
import io.dapprunner.descriptor.DescriptorException;
import io.dapprunner.descriptor.DescriptorReader;
import io.dapprunner.descriptor.ManifestVerifier;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import picocli.CommandLine;

@CommandLine.Command(
    name = "verify",
    description = "Load the descriptors and print the interpreted application, or the error found.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class
)
final class VerifyCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Parameters(arity = "1..*", paramLabel = "DESCRIPTOR", description = "Descriptor files, merged in order.")
    private List<Path> descriptors;

    @Override
    public Integer call() {
        var out = spec.commandLine().getOut();
        try {
            var dapp = DappDescriptor.load(DescriptorReader.readAll(descriptors));
            new ManifestVerifier().verifyAll(dapp);
            out.print(DescriptorReader.toYaml(dapp.toMap()));
            out.flush();
            return 0;
        } catch (DescriptorException ex) {
            var err = spec.commandLine().getErr();
            err.println(spec.commandLine().getColorScheme().errorText(ex.getMessage()));
            err.flush();
            return ShortErrorHandler.DESCRIPTOR_ERROR_EXIT_CODE;
        }
    }
}
