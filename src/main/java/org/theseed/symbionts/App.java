package org.theseed.symbionts;

import java.util.Arrays;

import org.theseed.symbionts.utils.BaseProcessor;

/**
 * Insect symbiont function prediction
 *
 * predict		predict symbiont functions from a taxon abundance table
 * host			display the lineage of one or more insect hosts
 *
 */
public class App
{

    /** static array containing command names and comments */
    protected static final String[] COMMANDS = new String[] {
             "predict", "predict symbiont functions from a taxon abundance table",
             "host", "display the lineage of one or more insect hosts",
    };

    public static void main( String[] args )
    {
        // Get the control parameter.
        String command = (args.length == 0 ? "--help" : args[0]);
        String[] newArgs = (args.length == 0 ? args : Arrays.copyOfRange(args, 1, args.length));
        BaseProcessor processor;
        // Parse the parameters.
        switch (command) {
        case "predict" -> processor = new PredictProcessor();
        case "host" -> processor = new HostQueryProcessor();
        case "-h", "--help" -> processor = null;
        default -> throw new RuntimeException("Invalid command " + command + ".");
        }
        if (processor == null)
            BaseProcessor.showCommands(COMMANDS);
        else {
            processor.parseCommand(newArgs);
            processor.run();
        }
    }
}
