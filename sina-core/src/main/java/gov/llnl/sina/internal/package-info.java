@javax.annotation.ParametersAreNonnullByDefault
package gov.llnl.sina.internal;
